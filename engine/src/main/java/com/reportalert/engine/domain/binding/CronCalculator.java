package com.reportalert.engine.domain.binding;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

public interface CronCalculator {

    /**
     * Next fire time strictly after {@code after} for a five-field cron expression
     * evaluated in {@code zone}. Empty when the expression never fires again.
     *
     * @throws com.reportalert.engine.domain.exceptions.InvalidScheduleException if the
     *         expression cannot be parsed
     */
    Optional<Instant> nextRunAfter(String cronExpression, ZoneId zone, Instant after);
}
