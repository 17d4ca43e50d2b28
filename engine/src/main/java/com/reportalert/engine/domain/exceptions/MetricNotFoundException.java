package com.reportalert.engine.domain.exceptions;

public class MetricNotFoundException extends RuntimeException {

    private MetricNotFoundException(String message) {
        super(message);
    }

    public static MetricNotFoundException of(String kpiId) {
        return new MetricNotFoundException("KPI " + kpiId + " not found");
    }
}
