package com.reportalert.engine.domain.exceptions;

/**
 * Raised by an {@code ArtifactDeliverer} when the rendered file could not be handed
 * to its recipients.
 */
public class ArtifactDeliveryException extends RuntimeException {

    public ArtifactDeliveryException(String message) {
        super(message);
    }

    public ArtifactDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }

    public static ArtifactDeliveryException noRecipients(String reportId) {
        return new ArtifactDeliveryException("No recipients configured for report " + reportId);
    }
}
