package com.reportalert.engine.infrastructure.cron;

import com.reportalert.engine.domain.binding.CronCalculator;
import com.reportalert.engine.domain.exceptions.InvalidScheduleException;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves five-field cron expressions with Spring's {@link CronExpression}, which
 * expects a leading seconds field.
 */
@Component
public class SpringCronCalculator implements CronCalculator {

    private final ConcurrentHashMap<String, CronExpression> parsed = new ConcurrentHashMap<>();

    @Override
    public Optional<Instant> nextRunAfter(String cronExpression, ZoneId zone, Instant after) {
        var expression = parse(cronExpression);
        var next = expression.next(after.atZone(zone));
        return Optional.ofNullable(next).map(ZonedDateTime::toInstant);
    }

    private CronExpression parse(String cronExpression) {
        if (cronExpression == null || cronExpression.isBlank()) {
            throw InvalidScheduleException.invalidCron(String.valueOf(cronExpression), null);
        }
        var fields = cronExpression.trim().split("\\s+");
        if (fields.length != 5) {
            throw InvalidScheduleException.invalidCron(cronExpression, null);
        }
        return parsed.computeIfAbsent(cronExpression.trim(), expr -> {
            try {
                return CronExpression.parse("0 " + expr);
            } catch (IllegalArgumentException e) {
                throw InvalidScheduleException.invalidCron(expr, e);
            }
        });
    }
}
