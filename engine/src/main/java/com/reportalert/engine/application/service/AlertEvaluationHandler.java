package com.reportalert.engine.application.service;

import com.reportalert.common.event.AlertTriggered;
import com.reportalert.engine.application.config.EngineProperties;
import com.reportalert.engine.domain.evaluation.AlertEvaluator;
import com.reportalert.engine.domain.evaluation.EvaluationResult;
import com.reportalert.engine.domain.evaluation.MetricReading;
import com.reportalert.engine.domain.evaluation.TriggeredAlert;
import com.reportalert.engine.domain.evaluation.TriggeredAlertPublisher;
import com.reportalert.engine.domain.exceptions.MetricNotFoundException;
import com.reportalert.engine.domain.metric.MetricRepository;
import com.reportalert.engine.domain.trigger.AlertTrigger;
import com.reportalert.engine.domain.trigger.AlertTriggerRepository;
import io.micrometer.core.instrument.Counter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * Entry point for KPI evaluation from REST and the sweep job. Each trigger is committed
 * by the evaluator as it fires; publication to Kafka happens afterwards and never fails
 * the evaluation.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AlertEvaluationHandler {

    private final AlertEvaluator alertEvaluator;
    private final AlertTriggerRepository triggerRepository;
    private final MetricRepository metricRepository;
    private final TriggeredAlertPublisher triggeredAlertPublisher;
    private final EngineProperties properties;
    private final Counter alertsTriggeredCounter;

    public EvaluationResult evaluate(String metricId, BigDecimal value, BigDecimal baseline) {
        var result = alertEvaluator.evaluate(metricId, value, baseline);
        afterEvaluation(result);
        return result;
    }

    public List<EvaluationResult> evaluateMany(List<MetricReading> readings) {
        var results = alertEvaluator.evaluateMany(readings);
        results.forEach(this::afterEvaluation);
        return results;
    }

    public List<AlertTrigger> triggerHistory(String metricId) {
        metricRepository.findById(metricId)
                .orElseThrow(() -> MetricNotFoundException.of(metricId));
        return triggerRepository.findByMetricId(metricId, properties.alerts().historyLimit());
    }

    private void afterEvaluation(EvaluationResult result) {
        if (result.isFailed() || result.triggeredCount() == 0) {
            return;
        }
        alertsTriggeredCounter.increment(result.triggeredCount());
        if (!properties.alerts().publishTriggers()) {
            return;
        }
        for (var alert : result.triggeredAlerts()) {
            try {
                triggeredAlertPublisher.publish(toEvent(result, alert));
            } catch (RuntimeException e) {
                log.error("Failed to publish trigger {} for KPI {}: {}",
                        alert.historyId(), result.metricId(), e.getMessage());
            }
        }
    }

    private static AlertTriggered toEvent(EvaluationResult result, TriggeredAlert alert) {
        return AlertTriggered.builder()
                .historyId(alert.historyId())
                .ruleId(alert.ruleId())
                .kpiId(result.metricId())
                .kpiName(result.metricName())
                .condition(alert.condition().wireValue())
                .threshold(alert.threshold())
                .actualValue(result.currentValue())
                .message(alert.message())
                .channels(alert.channels())
                .recipients(alert.recipients())
                .triggeredAt(alert.triggeredAt())
                .build();
    }
}
