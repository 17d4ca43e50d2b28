package com.reportalert.engine.application.controller.report;

import java.time.Instant;

/**
 * {@code cronExpression} and {@code nextRunAt} are null for frequencies without a cron job.
 */
public record ScheduleResponse(
        String reportId,
        String frequency,
        boolean scheduled,
        String cronExpression,
        String timezone,
        boolean active,
        Instant nextRunAt) {}
