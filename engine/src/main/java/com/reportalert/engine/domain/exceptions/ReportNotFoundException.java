package com.reportalert.engine.domain.exceptions;

public class ReportNotFoundException extends RuntimeException {

    private ReportNotFoundException(String message) {
        super(message);
    }

    public static ReportNotFoundException of(String reportId) {
        return new ReportNotFoundException("Report not found: " + reportId);
    }
}
