package com.reportalert.engine.domain.evaluation;

import java.math.BigDecimal;
import java.util.List;

/**
 * Outcome of evaluating one KPI reading. A failed batch entry carries only
 * {@code metricId} and {@code error}.
 */
public record EvaluationResult(
        String metricId,
        String metricName,
        BigDecimal currentValue,
        int alertsChecked,
        int triggeredCount,
        List<TriggeredAlert> triggeredAlerts,
        String error
) {

    public static EvaluationResult of(String metricId, String metricName, BigDecimal currentValue,
                                      int alertsChecked, List<TriggeredAlert> triggeredAlerts) {
        return new EvaluationResult(metricId, metricName, currentValue, alertsChecked,
                triggeredAlerts.size(), List.copyOf(triggeredAlerts), null);
    }

    public static EvaluationResult failed(String metricId, String error) {
        return new EvaluationResult(metricId, null, null, 0, 0, List.of(), error);
    }

    public boolean isFailed() {
        return error != null;
    }
}
