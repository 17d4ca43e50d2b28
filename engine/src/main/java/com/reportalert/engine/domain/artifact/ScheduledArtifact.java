package com.reportalert.engine.domain.artifact;

import lombok.Builder;

import java.time.Instant;
import java.util.List;

@Builder(toBuilder = true)
public record ScheduledArtifact(
        String id,
        String name,
        Frequency frequency,
        boolean scheduled,
        ScheduleConfig scheduleConfig,
        String deliveryFormat,
        List<String> recipients,
        Instant lastSentAt,
        Instant nextRunAt,
        int sendCount
) {

    public boolean hasRecipients() {
        return recipients != null && !recipients.isEmpty();
    }
}
