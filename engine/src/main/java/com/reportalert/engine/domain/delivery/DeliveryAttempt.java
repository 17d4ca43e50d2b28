package com.reportalert.engine.domain.delivery;

import com.reportalert.engine.domain.artifact.ScheduledArtifact;
import lombok.Builder;

import java.time.Instant;
import java.util.List;

@Builder(toBuilder = true)
public record DeliveryAttempt(
        String id,
        String artifactId,
        String deliveryFormat,
        List<String> recipients,
        DeliveryStatus status,
        String errorMessage,
        Long fileSize,
        Instant deliveredAt
) {

    public static DeliveryAttempt pending(String id, ScheduledArtifact artifact, Instant startedAt) {
        return DeliveryAttempt.builder()
                .id(id)
                .artifactId(artifact.id())
                .deliveryFormat(artifact.deliveryFormat())
                .recipients(artifact.recipients() != null ? List.copyOf(artifact.recipients()) : List.of())
                .status(DeliveryStatus.PENDING)
                .deliveredAt(startedAt)
                .build();
    }
}
