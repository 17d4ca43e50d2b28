package com.reportalert.engine.application.controller.alert;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public record AlertRuleResponse(
        String id,
        String kpiId,
        String condition,
        BigDecimal threshold,
        List<String> channels,
        List<String> recipients,
        boolean active,
        Instant createdAt) {}
