package com.reportalert.engine.domain.exceptions;

public class JobBindingNotFoundException extends RuntimeException {

    private JobBindingNotFoundException(String message) {
        super(message);
    }

    public static JobBindingNotFoundException forReport(String reportId) {
        return new JobBindingNotFoundException("No scheduled job for report " + reportId);
    }
}
