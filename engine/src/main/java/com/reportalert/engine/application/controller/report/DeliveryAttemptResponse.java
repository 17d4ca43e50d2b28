package com.reportalert.engine.application.controller.report;

import java.time.Instant;
import java.util.List;

public record DeliveryAttemptResponse(
        String id,
        String reportId,
        String deliveryFormat,
        List<String> recipients,
        String status,
        String errorMessage,
        Long fileSize,
        Instant deliveredAt) {}
