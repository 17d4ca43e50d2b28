package com.reportalert.engine.application.controller.alert;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

import java.math.BigDecimal;
import java.util.List;

public record UpdateAlertRuleRequest(
        @Pattern(regexp = AlertRuleConditions.PATTERN, message = AlertRuleConditions.MESSAGE)
        String condition,
        BigDecimal threshold,
        List<@Pattern(regexp = "^(email|slack|webhook)$", message = "Channel must be email, slack or webhook") String> channels,
        List<@NotBlank String> recipients,
        Boolean active) {}
