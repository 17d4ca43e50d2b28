package com.reportalert.engine.domain.schedule;

import static org.assertj.core.api.Assertions.assertThat;

import com.reportalert.engine.domain.artifact.Frequency;
import com.reportalert.engine.domain.artifact.ScheduledArtifact;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class DueSetResolverTest {

    private static final Instant NOW = Instant.parse("2024-03-10T12:00:00Z");

    private final DueSetResolver resolver = new DueSetResolver();

    private static ScheduledArtifact report(String id, Frequency frequency, boolean scheduled, Instant lastSentAt) {
        return ScheduledArtifact.builder()
                .id(id)
                .name("Report " + id)
                .frequency(frequency)
                .scheduled(scheduled)
                .lastSentAt(lastSentAt)
                .recipients(List.of("ops@example.com"))
                .build();
    }

    @Nested
    class IsDue {

        @Test
        void shouldBeDueWhenNeverSent() {
            // given
            var report = report("r1", Frequency.DAILY, true, null);

            // when / then
            assertThat(resolver.isDue(report, NOW)).isTrue();
        }

        @Test
        void shouldNotBeDueWhenUnscheduled() {
            // given
            var report = report("r1", Frequency.DAILY, false, null);

            // when / then
            assertThat(resolver.isDue(report, NOW)).isFalse();
        }

        @Test
        void shouldNeverBeDueForOnDemand() {
            // given
            var neverSent = report("r1", Frequency.ON_DEMAND, true, null);
            var sentLongAgo = report("r2", Frequency.ON_DEMAND, true, NOW.minus(Duration.ofDays(365)));

            // when / then
            assertThat(resolver.isDue(neverSent, NOW)).isFalse();
            assertThat(resolver.isDue(sentLongAgo, NOW)).isFalse();
        }

        @ParameterizedTest
        @CsvSource({
                "HOURLY, PT1H",
                "DAILY, PT24H",
                "WEEKLY, P7D",
                "MONTHLY, P30D",
                "REALTIME, PT24H"
        })
        void shouldBeDueExactlyAtTheInterval(Frequency frequency, Duration interval) {
            // given
            var atBoundary = report("r1", frequency, true, NOW.minus(interval));
            var justBefore = report("r2", frequency, true, NOW.minus(interval).plusSeconds(1));

            // when / then
            assertThat(resolver.isDue(atBoundary, NOW)).isTrue();
            assertThat(resolver.isDue(justBefore, NOW)).isFalse();
        }

        @Test
        void shouldUseDailyIntervalWhenFrequencyMissing() {
            // given
            var sent23HoursAgo = report("r1", null, true, NOW.minus(Duration.ofHours(23)));
            var sent25HoursAgo = report("r2", null, true, NOW.minus(Duration.ofHours(25)));

            // when / then
            assertThat(resolver.isDue(sent23HoursAgo, NOW)).isFalse();
            assertThat(resolver.isDue(sent25HoursAgo, NOW)).isTrue();
        }

        @Test
        void shouldApplyIntervalWithoutScheduleConfig() {
            // given
            var report = report("r1", Frequency.WEEKLY, true, NOW.minus(Duration.ofDays(8))).toBuilder()
                    .scheduleConfig(null)
                    .build();

            // when / then
            assertThat(resolver.isDue(report, NOW)).isTrue();
        }
    }

    @Nested
    class FindDue {

        @Test
        void shouldReturnOnlyDueReportsInInputOrder() {
            // given
            var dueC = report("c", Frequency.HOURLY, true, NOW.minus(Duration.ofHours(2)));
            var notDue = report("b", Frequency.DAILY, true, NOW.minus(Duration.ofHours(1)));
            var dueA = report("a", Frequency.DAILY, true, null);
            var unscheduled = report("d", Frequency.DAILY, false, null);

            // when
            var due = resolver.findDue(List.of(dueC, notDue, dueA, unscheduled), NOW);

            // then
            assertThat(due).extracting(ScheduledArtifact::id).containsExactly("c", "a");
        }

        @Test
        void shouldReturnEmptyForEmptyInput() {
            // when / then
            assertThat(resolver.findDue(List.of(), NOW)).isEmpty();
        }
    }
}
