package com.reportalert.engine.domain.evaluation;

import com.reportalert.engine.domain.rule.ThresholdCondition;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Builder
public record TriggeredAlert(
        String ruleId,
        ThresholdCondition condition,
        BigDecimal threshold,
        String message,
        String historyId,
        List<String> channels,
        List<String> recipients,
        Instant triggeredAt
) {
}
