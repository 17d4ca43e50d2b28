package com.reportalert.engine.application.controller.report;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

public record ScheduleReportRequest(
        @NotBlank
        String frequency,

        @Pattern(regexp = "^([01]?\\d|2[0-3]):[0-5]\\d$", message = "Time must be HH:mm")
        String time,

        String dayOfWeek,

        @Min(1) @Max(31)
        Integer dayOfMonth,

        String timezone
) {
}
