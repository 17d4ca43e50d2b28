package com.reportalert.engine.domain.evaluation;

import com.reportalert.common.id.UlidGenerator;
import com.reportalert.engine.domain.exceptions.MetricNotFoundException;
import com.reportalert.engine.domain.metric.MetricRepository;
import com.reportalert.engine.domain.rule.ThresholdCondition;
import com.reportalert.engine.domain.rule.ThresholdRule;
import com.reportalert.engine.domain.rule.ThresholdRuleRepository;
import com.reportalert.engine.domain.trigger.AlertTrigger;
import com.reportalert.engine.domain.trigger.AlertTriggerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Checks a KPI reading against the KPI's active threshold rules and appends a trigger
 * record for every rule the reading satisfies. Every satisfying evaluation fires;
 * there is no cooldown between consecutive triggers of the same rule.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertEvaluator {

    static final String HISTORY_ID_PREFIX = "ah";

    private final MetricRepository metricRepository;
    private final ThresholdRuleRepository ruleRepository;
    private final AlertTriggerRepository triggerRepository;
    private final Clock clock;

    public EvaluationResult evaluate(String metricId, BigDecimal currentValue, BigDecimal baseline) {
        Objects.requireNonNull(currentValue, "currentValue");
        var metric = metricRepository.findById(metricId)
                .orElseThrow(() -> MetricNotFoundException.of(metricId));

        var activeRules = ruleRepository.findByMetricId(metricId).stream()
                .filter(ThresholdRule::active)
                .toList();
        if (activeRules.isEmpty()) {
            return EvaluationResult.of(metricId, metric.name(), currentValue, 0, List.of());
        }

        var triggered = new ArrayList<TriggeredAlert>();
        for (var rule : activeRules) {
            var condition = rule.knownCondition();
            if (condition.isEmpty()) {
                log.debug("Skipping alert rule {} with unknown condition '{}'", rule.id(), rule.condition());
                continue;
            }
            if (condition.get().isSatisfied(currentValue, rule.threshold(), baseline)) {
                triggered.add(fire(rule, condition.get(), metric.name(), currentValue));
            }
        }

        if (!triggered.isEmpty()) {
            log.info("KPI {} value {} triggered {} of {} alert rule(s)",
                    metricId, currentValue.toPlainString(), triggered.size(), activeRules.size());
        }
        return EvaluationResult.of(metricId, metric.name(), currentValue, activeRules.size(), triggered);
    }

    /**
     * Evaluates each reading independently. A reading that fails produces a failed
     * result in its slot; the output has the input's length and order.
     */
    public List<EvaluationResult> evaluateMany(List<MetricReading> readings) {
        var results = new ArrayList<EvaluationResult>(readings.size());
        for (var reading : readings) {
            try {
                results.add(evaluate(reading.metricId(), reading.value(), reading.baseline()));
            } catch (RuntimeException e) {
                log.warn("Evaluation of KPI {} failed: {}", reading.metricId(), e.getMessage());
                results.add(EvaluationResult.failed(reading.metricId(),
                        e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
            }
        }
        return results;
    }

    private TriggeredAlert fire(ThresholdRule rule, ThresholdCondition condition, String metricName,
                                BigDecimal currentValue) {
        var message = condition.message(metricName, currentValue, rule.threshold());
        var trigger = triggerRepository.save(AlertTrigger.builder()
                .id(UlidGenerator.prefixed(HISTORY_ID_PREFIX))
                .ruleId(rule.id())
                .metricId(rule.metricId())
                .actualValue(currentValue)
                .threshold(rule.threshold())
                .message(message)
                .triggeredAt(clock.instant())
                .build());
        log.debug("Alert rule {} fired: {}", rule.id(), message);
        return TriggeredAlert.builder()
                .ruleId(rule.id())
                .condition(condition)
                .threshold(rule.threshold())
                .message(message)
                .historyId(trigger.id())
                .channels(rule.channels())
                .recipients(rule.recipients())
                .triggeredAt(trigger.triggeredAt())
                .build();
    }
}
