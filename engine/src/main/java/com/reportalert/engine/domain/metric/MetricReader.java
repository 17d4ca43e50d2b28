package com.reportalert.engine.domain.metric;

import java.math.BigDecimal;

/**
 * Reads the current value of a KPI from its source. Implementations throw
 * {@link com.reportalert.engine.domain.exceptions.MetricReadException} when the value is unavailable.
 */
public interface MetricReader {

    BigDecimal readMetricValue(String metricId);
}
