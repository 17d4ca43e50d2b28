package com.reportalert.engine.application.controller.alert;

import java.math.BigDecimal;
import java.time.Instant;

public record AlertHistoryResponse(
        String id,
        String alertId,
        String kpiId,
        BigDecimal actualValue,
        BigDecimal threshold,
        String message,
        Instant triggeredAt) {}
