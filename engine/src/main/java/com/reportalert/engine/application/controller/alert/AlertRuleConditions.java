package com.reportalert.engine.application.controller.alert;

import com.reportalert.engine.domain.rule.ThresholdCondition;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
final class AlertRuleConditions {

    static final String PATTERN = "^(above_threshold|below_threshold|equals|percent_change)$";
    static final String MESSAGE =
            "Condition must be one of above_threshold, below_threshold, equals, percent_change";

    static ThresholdCondition parse(String condition) {
        if (condition == null) {
            return null;
        }
        return ThresholdCondition.fromWireValue(condition)
                .orElseThrow(() -> new IllegalArgumentException("Unknown condition: " + condition));
    }
}
