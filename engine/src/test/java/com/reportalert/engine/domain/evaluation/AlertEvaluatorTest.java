package com.reportalert.engine.domain.evaluation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;

import com.reportalert.engine.domain.exceptions.MetricNotFoundException;
import com.reportalert.engine.domain.metric.Metric;
import com.reportalert.engine.domain.metric.MetricRepository;
import com.reportalert.engine.domain.rule.ThresholdCondition;
import com.reportalert.engine.domain.rule.ThresholdRule;
import com.reportalert.engine.domain.rule.ThresholdRuleRepository;
import com.reportalert.engine.domain.trigger.AlertTrigger;
import com.reportalert.engine.domain.trigger.AlertTriggerRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AlertEvaluatorTest {

    private static final Instant NOW = Instant.parse("2024-03-10T12:00:00Z");
    private static final String KPI_ID = "k_revenue";

    @Mock
    MetricRepository metricRepository;

    @Mock
    ThresholdRuleRepository ruleRepository;

    @Mock
    AlertTriggerRepository triggerRepository;

    private AlertEvaluator evaluator;

    @BeforeEach
    void setUp() {
        evaluator = new AlertEvaluator(metricRepository, ruleRepository, triggerRepository,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static ThresholdRule rule(String id, String condition, String threshold, boolean active) {
        return ThresholdRule.builder()
                .id(id)
                .metricId(KPI_ID)
                .condition(condition)
                .threshold(new BigDecimal(threshold))
                .channels(List.of("email"))
                .recipients(List.of("cfo@example.com"))
                .active(active)
                .createdAt(NOW)
                .build();
    }

    private void givenKpiWithRules(ThresholdRule... rules) {
        given(metricRepository.findById(KPI_ID)).willReturn(Optional.of(new Metric(KPI_ID, "Revenue")));
        given(ruleRepository.findByMetricId(KPI_ID)).willReturn(List.of(rules));
    }

    private void givenTriggersAreSaved() {
        given(triggerRepository.save(any(AlertTrigger.class))).willAnswer(inv -> inv.getArgument(0));
    }

    @Nested
    class Evaluate {

        @Test
        void shouldTriggerSatisfiedRuleAndRecordHistory() {
            // given
            givenKpiWithRules(rule("alert_1", "above_threshold", "100", true));
            givenTriggersAreSaved();

            // when
            var result = evaluator.evaluate(KPI_ID, new BigDecimal("150"), null);

            // then
            assertThat(result.metricName()).isEqualTo("Revenue");
            assertThat(result.alertsChecked()).isEqualTo(1);
            assertThat(result.triggeredCount()).isEqualTo(1);

            var captor = ArgumentCaptor.forClass(AlertTrigger.class);
            then(triggerRepository).should().save(captor.capture());
            var trigger = captor.getValue();
            assertThat(trigger.id()).startsWith("ah_");
            assertThat(trigger)
                    .usingRecursiveComparison()
                    .ignoringFields("id")
                    .withComparatorForType(BigDecimal::compareTo, BigDecimal.class)
                    .isEqualTo(AlertTrigger.builder()
                            .ruleId("alert_1")
                            .metricId(KPI_ID)
                            .actualValue(new BigDecimal("150"))
                            .threshold(new BigDecimal("100"))
                            .message("KPI \"Revenue\" value 150 exceeded threshold 100")
                            .triggeredAt(NOW)
                            .build());

            var triggered = result.triggeredAlerts().get(0);
            assertThat(triggered.ruleId()).isEqualTo("alert_1");
            assertThat(triggered.condition()).isEqualTo(ThresholdCondition.ABOVE_THRESHOLD);
            assertThat(triggered.historyId()).isEqualTo(trigger.id());
            assertThat(triggered.channels()).containsExactly("email");
            assertThat(triggered.recipients()).containsExactly("cfo@example.com");
        }

        @Test
        void shouldReturnNoTriggersWhenNoActiveRules() {
            // given
            givenKpiWithRules(rule("alert_1", "above_threshold", "100", false));

            // when
            var result = evaluator.evaluate(KPI_ID, new BigDecimal("150"), null);

            // then
            assertThat(result.alertsChecked()).isZero();
            assertThat(result.triggeredAlerts()).isEmpty();
            then(triggerRepository).should(never()).save(any());
        }

        @Test
        void shouldSkipUnknownConditionSilently() {
            // given
            givenKpiWithRules(
                    rule("alert_1", "trend_detection", "1", true),
                    rule("alert_2", "below_threshold", "200", true));
            givenTriggersAreSaved();

            // when
            var result = evaluator.evaluate(KPI_ID, new BigDecimal("150"), null);

            // then
            assertThat(result.alertsChecked()).isEqualTo(2);
            assertThat(result.triggeredAlerts()).extracting(TriggeredAlert::ruleId).containsExactly("alert_2");
        }

        @Test
        void shouldNotFirePercentChangeWithoutBaseline() {
            // given
            givenKpiWithRules(rule("alert_1", "percent_change", "10", true));

            // when
            var result = evaluator.evaluate(KPI_ID, new BigDecimal("500"), null);

            // then
            assertThat(result.triggeredCount()).isZero();
        }

        @Test
        void shouldFireEveryTimeWithoutCooldown() {
            // given
            givenKpiWithRules(rule("alert_1", "equals", "42", true));
            givenTriggersAreSaved();

            // when
            evaluator.evaluate(KPI_ID, new BigDecimal("42.0"), null);
            evaluator.evaluate(KPI_ID, new BigDecimal("42.00"), null);

            // then
            then(triggerRepository).should(times(2)).save(any(AlertTrigger.class));
        }

        @Test
        void shouldFailForUnknownKpi() {
            // given
            given(metricRepository.findById("missing")).willReturn(Optional.empty());

            // when / then
            assertThatThrownBy(() -> evaluator.evaluate("missing", BigDecimal.ONE, null))
                    .isInstanceOf(MetricNotFoundException.class)
                    .hasMessage("KPI missing not found");
        }
    }

    @Nested
    class EvaluateMany {

        @Test
        void shouldIsolateFailuresAndPreserveOrder() {
            // given
            givenKpiWithRules(rule("alert_1", "above_threshold", "100", true));
            given(metricRepository.findById("missing")).willReturn(Optional.empty());
            givenTriggersAreSaved();
            var readings = List.of(
                    new MetricReading(KPI_ID, new BigDecimal("150"), null),
                    new MetricReading("missing", new BigDecimal("1"), null),
                    new MetricReading(KPI_ID, new BigDecimal("50"), null));

            // when
            var results = evaluator.evaluateMany(readings);

            // then
            assertThat(results).hasSize(3);
            assertThat(results).extracting(EvaluationResult::metricId).containsExactly(KPI_ID, "missing", KPI_ID);
            assertThat(results.get(0).triggeredCount()).isEqualTo(1);
            assertThat(results.get(1).isFailed()).isTrue();
            assertThat(results.get(1).error()).isEqualTo("KPI missing not found");
            assertThat(results.get(2).isFailed()).isFalse();
            assertThat(results.get(2).triggeredCount()).isZero();
        }

        @Test
        void shouldReturnEmptyForEmptyBatch() {
            assertThat(evaluator.evaluateMany(List.of())).isEmpty();
        }
    }
}
