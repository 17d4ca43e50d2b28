package com.reportalert.engine.application.controller;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class ErrorCodes {

    public static final String REPORT_NOT_FOUND = "REPORT_NOT_FOUND";
    public static final String KPI_NOT_FOUND = "KPI_NOT_FOUND";
    public static final String ALERT_NOT_FOUND = "ALERT_NOT_FOUND";
    public static final String JOB_NOT_FOUND = "JOB_NOT_FOUND";
    public static final String INVALID_SCHEDULE = "INVALID_SCHEDULE";
    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";
}
