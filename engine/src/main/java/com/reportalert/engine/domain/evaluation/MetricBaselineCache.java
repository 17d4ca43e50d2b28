package com.reportalert.engine.domain.evaluation;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Last observed value per KPI, used as the percent-change baseline of the next reading.
 * Held in memory only; the first reading after startup has no baseline.
 */
@Component
public class MetricBaselineCache {

    private final ConcurrentHashMap<String, BigDecimal> lastValues = new ConcurrentHashMap<>();

    /**
     * Stores {@code value} as the latest reading and returns the previous one, or null.
     */
    public BigDecimal swap(String metricId, BigDecimal value) {
        return lastValues.put(metricId, value);
    }

    public int size() {
        return lastValues.size();
    }
}
