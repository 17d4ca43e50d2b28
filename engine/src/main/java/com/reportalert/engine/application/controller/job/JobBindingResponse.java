package com.reportalert.engine.application.controller.job;

import java.time.Instant;

public record JobBindingResponse(
        String id,
        String reportId,
        String cronExpression,
        String timezone,
        boolean active,
        Instant lastRunAt,
        Instant nextRunAt,
        String lastStatus,
        String lastError) {}
