package com.reportalert.engine.domain.delivery;

public record DeliveryOutcome(
        String artifactId,
        Result result,
        String attemptId,
        String message,
        Long fileSize
) {

    public enum Result {
        DELIVERED,
        FAILED,
        SKIPPED
    }

    public static DeliveryOutcome delivered(String artifactId, String attemptId, long fileSize) {
        return new DeliveryOutcome(artifactId, Result.DELIVERED, attemptId, null, fileSize);
    }

    public static DeliveryOutcome failed(String artifactId, String attemptId, String errorMessage) {
        return new DeliveryOutcome(artifactId, Result.FAILED, attemptId, errorMessage, null);
    }

    public static DeliveryOutcome skipped(String artifactId, String reason) {
        return new DeliveryOutcome(artifactId, Result.SKIPPED, null, reason, null);
    }

    public boolean isDelivered() {
        return result == Result.DELIVERED;
    }
}
