package com.reportalert.engine.domain.evaluation;

import java.math.BigDecimal;

/**
 * One entry of a batch evaluation. {@code baseline} may be null.
 */
public record MetricReading(String metricId, BigDecimal value, BigDecimal baseline) {
}
