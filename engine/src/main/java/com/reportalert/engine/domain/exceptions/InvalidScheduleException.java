package com.reportalert.engine.domain.exceptions;

public class InvalidScheduleException extends RuntimeException {

    private InvalidScheduleException(String message, Throwable cause) {
        super(message, cause);
    }

    public static InvalidScheduleException unknownFrequency(String frequency) {
        return new InvalidScheduleException("Unknown frequency: " + frequency, null);
    }

    public static InvalidScheduleException invalidTime(String time) {
        return new InvalidScheduleException("Invalid time of day (expected HH:mm): " + time, null);
    }

    public static InvalidScheduleException invalidDayOfWeek(String dayOfWeek) {
        return new InvalidScheduleException("Invalid day of week: " + dayOfWeek, null);
    }

    public static InvalidScheduleException invalidDayOfMonth(int dayOfMonth) {
        return new InvalidScheduleException("Day of month must be between 1 and 31: " + dayOfMonth, null);
    }

    public static InvalidScheduleException invalidTimezone(String timezone, Throwable cause) {
        return new InvalidScheduleException("Unknown timezone: " + timezone, cause);
    }

    public static InvalidScheduleException invalidCron(String cronExpression, Throwable cause) {
        return new InvalidScheduleException("Invalid cron expression: " + cronExpression, cause);
    }
}
