package com.reportalert.engine.domain.exceptions;

/**
 * Raised by an {@code ArtifactRenderer} when the report file cannot be produced.
 */
public class ArtifactRenderException extends RuntimeException {

    public ArtifactRenderException(String message) {
        super(message);
    }

    public ArtifactRenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
