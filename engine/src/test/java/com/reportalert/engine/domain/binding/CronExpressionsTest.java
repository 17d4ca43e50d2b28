package com.reportalert.engine.domain.binding;

import static org.assertj.core.api.Assertions.assertThat;

import com.reportalert.engine.domain.artifact.Frequency;
import com.reportalert.engine.domain.artifact.ScheduleConfig;
import java.time.DayOfWeek;
import java.time.LocalTime;
import org.junit.jupiter.api.Test;

class CronExpressionsTest {

    private static final ScheduleConfig AT_1430_FRIDAY_15TH = ScheduleConfig.builder()
            .timeOfDay(LocalTime.of(14, 30))
            .dayOfWeek(DayOfWeek.FRIDAY)
            .dayOfMonth(15)
            .build();

    @Test
    void shouldDeriveDailyExpression() {
        assertThat(CronExpressions.forSchedule(Frequency.DAILY, AT_1430_FRIDAY_15TH)).contains("30 14 * * *");
    }

    @Test
    void shouldDeriveWeeklyExpression() {
        assertThat(CronExpressions.forSchedule(Frequency.WEEKLY, AT_1430_FRIDAY_15TH)).contains("30 14 * * 5");
    }

    @Test
    void shouldMapSundayToZero() {
        // given
        var sunday = ScheduleConfig.builder().dayOfWeek(DayOfWeek.SUNDAY).build();

        // when / then
        assertThat(CronExpressions.forSchedule(Frequency.WEEKLY, sunday)).contains("0 9 * * 0");
    }

    @Test
    void shouldDeriveMonthlyExpression() {
        assertThat(CronExpressions.forSchedule(Frequency.MONTHLY, AT_1430_FRIDAY_15TH)).contains("30 14 15 * *");
    }

    @Test
    void shouldDeriveHourlyExpressionFromMinute() {
        assertThat(CronExpressions.forSchedule(Frequency.HOURLY, AT_1430_FRIDAY_15TH)).contains("30 * * * *");
    }

    @Test
    void shouldUseDefaultsWhenConfigMissing() {
        assertThat(CronExpressions.forSchedule(Frequency.DAILY, null)).contains("0 9 * * *");
        assertThat(CronExpressions.forSchedule(Frequency.WEEKLY, ScheduleConfig.EMPTY)).contains("0 9 * * 1");
        assertThat(CronExpressions.forSchedule(Frequency.MONTHLY, ScheduleConfig.EMPTY)).contains("0 9 1 * *");
    }

    @Test
    void shouldHaveNoExpressionForRealtimeAndOnDemand() {
        assertThat(CronExpressions.forSchedule(Frequency.REALTIME, AT_1430_FRIDAY_15TH)).isEmpty();
        assertThat(CronExpressions.forSchedule(Frequency.ON_DEMAND, AT_1430_FRIDAY_15TH)).isEmpty();
    }
}
