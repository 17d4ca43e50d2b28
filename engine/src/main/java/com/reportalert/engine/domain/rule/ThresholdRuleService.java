package com.reportalert.engine.domain.rule;

import com.reportalert.common.id.UlidGenerator;
import com.reportalert.engine.domain.exceptions.MetricNotFoundException;
import com.reportalert.engine.domain.exceptions.ThresholdRuleNotFoundException;
import com.reportalert.engine.domain.metric.MetricRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ThresholdRuleService {

    static final String ID_PREFIX = "alert";

    private final ThresholdRuleRepository ruleRepository;
    private final MetricRepository metricRepository;
    private final Clock clock;

    public ThresholdRule createRule(String metricId, ThresholdCondition condition, BigDecimal threshold,
                                    List<String> channels, List<String> recipients) {
        metricRepository.findById(metricId)
                .orElseThrow(() -> MetricNotFoundException.of(metricId));
        var rule = ThresholdRule.builder()
                .id(UlidGenerator.prefixed(ID_PREFIX))
                .metricId(metricId)
                .condition(condition.wireValue())
                .threshold(threshold)
                .channels(channels != null ? List.copyOf(channels) : List.of("email"))
                .recipients(recipients != null ? List.copyOf(recipients) : List.of())
                .active(true)
                .createdAt(clock.instant())
                .build();
        var saved = ruleRepository.save(rule);
        log.info("Created alert rule {} on KPI {}: {} {}", saved.id(), metricId, saved.condition(), threshold);
        return saved;
    }

    public List<ThresholdRule> listRules(String metricId) {
        metricRepository.findById(metricId)
                .orElseThrow(() -> MetricNotFoundException.of(metricId));
        return ruleRepository.findByMetricId(metricId);
    }

    public ThresholdRule updateRule(String ruleId, ThresholdCondition condition, BigDecimal threshold,
                                    List<String> channels, List<String> recipients, Boolean active) {
        var rule = getRule(ruleId);
        var updated = rule.toBuilder()
                .condition(condition != null ? condition.wireValue() : rule.condition())
                .threshold(threshold != null ? threshold : rule.threshold())
                .channels(channels != null ? List.copyOf(channels) : rule.channels())
                .recipients(recipients != null ? List.copyOf(recipients) : rule.recipients())
                .active(active != null ? active : rule.active())
                .build();
        var saved = ruleRepository.save(updated);
        log.info("Updated alert rule {}", ruleId);
        return saved;
    }

    public void deleteRule(String ruleId) {
        getRule(ruleId);
        ruleRepository.deleteById(ruleId);
        log.info("Deleted alert rule {}", ruleId);
    }

    public ThresholdRule getRule(String ruleId) {
        return ruleRepository.findById(ruleId)
                .orElseThrow(() -> ThresholdRuleNotFoundException.of(ruleId));
    }
}
