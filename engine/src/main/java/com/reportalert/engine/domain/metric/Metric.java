package com.reportalert.engine.domain.metric;

public record Metric(String id, String name) {
}
