package com.reportalert.engine.application.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.ZoneId;

@Validated
@ConfigurationProperties(prefix = "engine")
public record EngineProperties(
        @NotNull @Valid Scheduler scheduler,
        @NotNull @Valid Delivery delivery,
        @NotNull @Valid Alerts alerts) {

    /**
     * @param enabled            start the tick timer with the application context
     * @param tickInterval       fixed delay between two ticks
     * @param workerPoolSize     reports delivered in parallel within one tick
     * @param shutdownGracePeriod time in-flight deliveries get to finish on shutdown
     * @param defaultTimezone    zone for schedules that do not name one
     */
    public record Scheduler(
            boolean enabled,
            @NotNull Duration tickInterval,
            @Min(1) int workerPoolSize,
            @NotNull Duration shutdownGracePeriod,
            @NotNull ZoneId defaultTimezone) {}

    public record Delivery(
            @NotNull Duration attemptTimeout,
            @Min(1) int collaboratorPoolSize,
            @Min(1) int historyLimit) {}

    public record Alerts(
            @NotBlank String sweepCron,
            @NotNull ZoneId sweepTimezone,
            boolean publishTriggers,
            @Min(1) int historyLimit) {}
}
