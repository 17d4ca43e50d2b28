package com.reportalert.engine.domain.rule;

import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * A threshold rule on a KPI. {@code condition} keeps the stored text so rules with a
 * condition this engine does not know survive reads and writes unchanged.
 */
@Builder(toBuilder = true)
public record ThresholdRule(
        String id,
        String metricId,
        String condition,
        BigDecimal threshold,
        List<String> channels,
        List<String> recipients,
        boolean active,
        Instant createdAt
) {

    public Optional<ThresholdCondition> knownCondition() {
        return ThresholdCondition.fromWireValue(condition);
    }
}
