package com.reportalert.engine.domain.exceptions;

public class MetricReadException extends RuntimeException {

    public MetricReadException(String message) {
        super(message);
    }

    public MetricReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
