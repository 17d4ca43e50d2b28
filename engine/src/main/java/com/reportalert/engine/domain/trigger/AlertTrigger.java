package com.reportalert.engine.domain.trigger;

import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;

@Builder(toBuilder = true)
public record AlertTrigger(
        String id,
        String ruleId,
        String metricId,
        BigDecimal actualValue,
        BigDecimal threshold,
        String message,
        Instant triggeredAt
) {
}
