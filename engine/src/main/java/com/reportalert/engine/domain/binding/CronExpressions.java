package com.reportalert.engine.domain.binding;

import com.reportalert.engine.domain.artifact.Frequency;
import com.reportalert.engine.domain.artifact.ScheduleConfig;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import java.util.Optional;

/**
 * Derives the five-field cron expression ({@code minute hour day-of-month month day-of-week})
 * for a report schedule.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class CronExpressions {

    public static Optional<String> forSchedule(Frequency frequency, ScheduleConfig config) {
        var schedule = config != null ? config : ScheduleConfig.EMPTY;
        var time = schedule.timeOfDayOrDefault();
        var minute = time.getMinute();
        var hour = time.getHour();
        return switch (frequency) {
            case HOURLY -> Optional.of(minute + " * * * *");
            case DAILY -> Optional.of(minute + " " + hour + " * * *");
            case WEEKLY -> Optional.of(minute + " " + hour + " * * " + cronDayOfWeek(schedule));
            case MONTHLY -> Optional.of(minute + " " + hour + " " + schedule.dayOfMonthOrDefault() + " * *");
            case REALTIME, ON_DEMAND -> Optional.empty();
        };
    }

    // cron counts Sunday as 0
    private static int cronDayOfWeek(ScheduleConfig schedule) {
        return schedule.dayOfWeekOrDefault().getValue() % 7;
    }
}
