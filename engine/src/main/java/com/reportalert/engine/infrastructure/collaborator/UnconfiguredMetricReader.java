package com.reportalert.engine.infrastructure.collaborator;

import com.reportalert.engine.domain.exceptions.MetricReadException;
import com.reportalert.engine.domain.metric.MetricReader;

import java.math.BigDecimal;

public class UnconfiguredMetricReader implements MetricReader {

    @Override
    public BigDecimal readMetricValue(String metricId) {
        throw new MetricReadException("No KPI value source configured for " + metricId);
    }
}
