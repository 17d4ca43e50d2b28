package com.reportalert.engine.application.service;

import com.reportalert.engine.domain.rule.ThresholdCondition;
import com.reportalert.engine.domain.rule.ThresholdRule;
import com.reportalert.engine.domain.rule.ThresholdRuleService;
import io.micrometer.core.instrument.Counter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

@Component
@RequiredArgsConstructor
public class AlertRuleCommandHandler {

    private final ThresholdRuleService ruleService;
    private final Counter alertRulesCreatedCounter;

    @Transactional
    public ThresholdRule createRule(String metricId, ThresholdCondition condition, BigDecimal threshold,
                                    List<String> channels, List<String> recipients) {
        var rule = ruleService.createRule(metricId, condition, threshold, channels, recipients);
        alertRulesCreatedCounter.increment();
        return rule;
    }

    @Transactional(readOnly = true)
    public List<ThresholdRule> listRules(String metricId) {
        return ruleService.listRules(metricId);
    }

    @Transactional
    public ThresholdRule updateRule(String ruleId, ThresholdCondition condition, BigDecimal threshold,
                                    List<String> channels, List<String> recipients, Boolean active) {
        return ruleService.updateRule(ruleId, condition, threshold, channels, recipients, active);
    }

    @Transactional
    public void deleteRule(String ruleId) {
        ruleService.deleteRule(ruleId);
    }
}
