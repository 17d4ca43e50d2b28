package com.reportalert.engine.application.controller.evaluation;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record EvaluationResponse(
        String kpiId,
        String kpiName,
        BigDecimal currentValue,
        Integer alertsChecked,
        Integer triggeredCount,
        List<TriggeredAlertResponse> triggeredAlerts,
        String error) {

    public record TriggeredAlertResponse(
            String alertId,
            String condition,
            BigDecimal threshold,
            String message,
            String historyId,
            List<String> channels,
            List<String> recipients) {}
}
