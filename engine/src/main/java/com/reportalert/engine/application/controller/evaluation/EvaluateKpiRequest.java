package com.reportalert.engine.application.controller.evaluation;

import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

public record EvaluateKpiRequest(
        @NotNull BigDecimal value,
        BigDecimal baseline) {}
