package com.reportalert.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import lombok.Builder;

/**
 * Published once per satisfied threshold rule so a notifier can dispatch to the
 * rule's channels without reading the rule store again.
 */
@Builder(toBuilder = true)
public record AlertTriggered(
        @JsonProperty("history_id") String historyId,
        @JsonProperty("rule_id") String ruleId,
        @JsonProperty("kpi_id") String kpiId,
        @JsonProperty("kpi_name") String kpiName,
        String condition,
        BigDecimal threshold,
        @JsonProperty("actual_value") BigDecimal actualValue,
        String message,
        List<String> channels,
        List<String> recipients,
        @JsonProperty("triggered_at") Instant triggeredAt) {}
