package com.reportalert.engine.domain.artifact;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.reportalert.engine.domain.exceptions.InvalidScheduleException;
import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZoneId;
import org.junit.jupiter.api.Test;

class ScheduleConfigTest {

    @Test
    void shouldParseAllFields() {
        // when
        var config = ScheduleConfig.parse("14:30", "Friday", 15, "Europe/Paris");

        // then
        assertThat(config).isEqualTo(new ScheduleConfig(
                DayOfWeek.FRIDAY, 15, LocalTime.of(14, 30), ZoneId.of("Europe/Paris")));
    }

    @Test
    void shouldApplyDefaultsForMissingFields() {
        // when
        var config = ScheduleConfig.parse(null, " ", null, null);

        // then
        assertThat(config).isEqualTo(ScheduleConfig.EMPTY);
        assertThat(config.timeOfDayOrDefault()).isEqualTo(LocalTime.of(9, 0));
        assertThat(config.dayOfWeekOrDefault()).isEqualTo(DayOfWeek.MONDAY);
        assertThat(config.dayOfMonthOrDefault()).isEqualTo(1);
        assertThat(config.timezoneOr(ZoneId.of("UTC"))).isEqualTo(ZoneId.of("UTC"));
    }

    @Test
    void shouldAcceptSingleDigitHour() {
        // when
        var config = ScheduleConfig.parse("7:05", null, null, null);

        // then
        assertThat(config.timeOfDay()).isEqualTo(LocalTime.of(7, 5));
        assertThat(config.formattedTimeOfDay()).isEqualTo("07:05");
    }

    @Test
    void shouldRejectMalformedTime() {
        assertThatThrownBy(() -> ScheduleConfig.parse("25:00", null, null, null))
                .isInstanceOf(InvalidScheduleException.class)
                .hasMessageContaining("25:00");
    }

    @Test
    void shouldRejectUnknownDayOfWeek() {
        assertThatThrownBy(() -> ScheduleConfig.parse(null, "someday", null, null))
                .isInstanceOf(InvalidScheduleException.class)
                .hasMessageContaining("someday");
    }

    @Test
    void shouldRejectUnknownTimezone() {
        assertThatThrownBy(() -> ScheduleConfig.parse(null, null, null, "Mars/Olympus"))
                .isInstanceOf(InvalidScheduleException.class)
                .hasMessageContaining("Mars/Olympus");
    }

    @Test
    void shouldRejectDayOfMonthOutOfRange() {
        assertThatThrownBy(() -> ScheduleConfig.parse(null, null, 32, null))
                .isInstanceOf(InvalidScheduleException.class);
        assertThatThrownBy(() -> ScheduleConfig.parse(null, null, 0, null))
                .isInstanceOf(InvalidScheduleException.class);
    }
}
