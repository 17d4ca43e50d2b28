package com.reportalert.engine.domain.exceptions;

public class ThresholdRuleNotFoundException extends RuntimeException {

    private ThresholdRuleNotFoundException(String message) {
        super(message);
    }

    public static ThresholdRuleNotFoundException of(String ruleId) {
        return new ThresholdRuleNotFoundException("Alert rule not found: " + ruleId);
    }
}
