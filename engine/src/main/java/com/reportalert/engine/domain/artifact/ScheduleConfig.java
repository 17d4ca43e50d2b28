package com.reportalert.engine.domain.artifact;

import com.reportalert.engine.domain.exceptions.InvalidScheduleException;
import lombok.Builder;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Typed form of a report's {@code schedule_config}. Every field is optional; the
 * {@code *OrDefault} accessors apply the defaults used when deriving a cron expression.
 */
@Builder(toBuilder = true)
public record ScheduleConfig(
        DayOfWeek dayOfWeek,
        Integer dayOfMonth,
        LocalTime timeOfDay,
        ZoneId timezone
) {

    public static final ScheduleConfig EMPTY = ScheduleConfig.builder().build();

    static final LocalTime DEFAULT_TIME_OF_DAY = LocalTime.of(9, 0);
    static final DayOfWeek DEFAULT_DAY_OF_WEEK = DayOfWeek.MONDAY;
    static final int DEFAULT_DAY_OF_MONTH = 1;

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("H:mm");

    public ScheduleConfig {
        if (dayOfMonth != null && (dayOfMonth < 1 || dayOfMonth > 31)) {
            throw InvalidScheduleException.invalidDayOfMonth(dayOfMonth);
        }
    }

    /**
     * Builds a config from its textual form ({@code "09:30"}, {@code "monday"},
     * {@code 15}, {@code "Europe/Paris"}), rejecting values that cannot be parsed.
     */
    public static ScheduleConfig parse(String time, String dayOfWeek, Integer dayOfMonth, String timezone) {
        return new ScheduleConfig(
                parseDayOfWeek(dayOfWeek),
                dayOfMonth,
                parseTime(time),
                parseZone(timezone));
    }

    public LocalTime timeOfDayOrDefault() {
        return timeOfDay != null ? timeOfDay : DEFAULT_TIME_OF_DAY;
    }

    public DayOfWeek dayOfWeekOrDefault() {
        return dayOfWeek != null ? dayOfWeek : DEFAULT_DAY_OF_WEEK;
    }

    public int dayOfMonthOrDefault() {
        return dayOfMonth != null ? dayOfMonth : DEFAULT_DAY_OF_MONTH;
    }

    public ZoneId timezoneOr(ZoneId fallback) {
        return timezone != null ? timezone : fallback;
    }

    public String formattedTimeOfDay() {
        return timeOfDay == null ? null : timeOfDay.format(DateTimeFormatter.ofPattern("HH:mm"));
    }

    private static LocalTime parseTime(String time) {
        if (time == null || time.isBlank()) {
            return null;
        }
        try {
            return LocalTime.parse(time.trim(), TIME_FORMAT);
        } catch (DateTimeParseException e) {
            throw InvalidScheduleException.invalidTime(time);
        }
    }

    private static DayOfWeek parseDayOfWeek(String dayOfWeek) {
        if (dayOfWeek == null || dayOfWeek.isBlank()) {
            return null;
        }
        try {
            return DayOfWeek.valueOf(dayOfWeek.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw InvalidScheduleException.invalidDayOfWeek(dayOfWeek);
        }
    }

    private static ZoneId parseZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return null;
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            throw InvalidScheduleException.invalidTimezone(timezone, e);
        }
    }
}
