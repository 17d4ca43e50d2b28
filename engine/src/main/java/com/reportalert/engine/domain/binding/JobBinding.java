package com.reportalert.engine.domain.binding;

import com.reportalert.engine.domain.delivery.DeliveryStatus;
import lombok.Builder;

import java.time.Instant;

@Builder(toBuilder = true)
public record JobBinding(
        String id,
        String artifactId,
        String cronExpression,
        String timezone,
        boolean active,
        Instant lastRunAt,
        Instant nextRunAt,
        DeliveryStatus lastStatus,
        String lastError,
        Instant createdAt,
        Instant updatedAt
) {
}
