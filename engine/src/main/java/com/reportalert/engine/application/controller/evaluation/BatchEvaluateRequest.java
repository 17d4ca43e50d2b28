package com.reportalert.engine.application.controller.evaluation;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;
import java.util.List;

public record BatchEvaluateRequest(
        @NotEmpty List<@Valid Reading> readings) {

    public record Reading(
            @NotBlank String kpiId,
            @NotNull BigDecimal value,
            BigDecimal baseline) {}
}
