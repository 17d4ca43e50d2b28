package com.reportalert.engine.domain.rule;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ThresholdConditionTest {

    private static BigDecimal bd(String value) {
        return new BigDecimal(value);
    }

    @Nested
    class AboveThreshold {

        @Test
        void shouldFireOnlyStrictlyAbove() {
            var condition = ThresholdCondition.ABOVE_THRESHOLD;
            assertThat(condition.isSatisfied(bd("100.01"), bd("100"), null)).isTrue();
            assertThat(condition.isSatisfied(bd("100"), bd("100"), null)).isFalse();
            assertThat(condition.isSatisfied(bd("99"), bd("100"), null)).isFalse();
        }
    }

    @Nested
    class BelowThreshold {

        @Test
        void shouldFireOnlyStrictlyBelow() {
            var condition = ThresholdCondition.BELOW_THRESHOLD;
            assertThat(condition.isSatisfied(bd("99.99"), bd("100"), null)).isTrue();
            assertThat(condition.isSatisfied(bd("100"), bd("100"), null)).isFalse();
            assertThat(condition.isSatisfied(bd("-5"), bd("0"), null)).isTrue();
        }
    }

    @Nested
    class EqualsThreshold {

        @Test
        void shouldCompareNumericallyIgnoringScale() {
            assertThat(ThresholdCondition.EQUALS.isSatisfied(bd("100.00"), bd("100"), null)).isTrue();
        }

        @Test
        void shouldNotApplyTolerance() {
            assertThat(ThresholdCondition.EQUALS.isSatisfied(bd("100.0000001"), bd("100"), null)).isFalse();
        }
    }

    @Nested
    class PercentChange {

        @Test
        void shouldBeSymmetricAroundBaseline() {
            var condition = ThresholdCondition.PERCENT_CHANGE;
            assertThat(condition.isSatisfied(bd("120"), bd("20"), bd("100"))).isFalse();
            assertThat(condition.isSatisfied(bd("80"), bd("20"), bd("100"))).isFalse();
            assertThat(condition.isSatisfied(bd("120"), bd("19.99"), bd("100"))).isTrue();
            assertThat(condition.isSatisfied(bd("80"), bd("19.99"), bd("100"))).isTrue();
        }

        @Test
        void shouldNeverFireWithoutBaseline() {
            var condition = ThresholdCondition.PERCENT_CHANGE;
            assertThat(condition.isSatisfied(bd("1000"), bd("1"), null)).isFalse();
            assertThat(condition.isSatisfied(bd("1000"), bd("1"), BigDecimal.ZERO)).isFalse();
            assertThat(condition.isSatisfied(bd("1000"), bd("1"), bd("0.00"))).isFalse();
        }

        @Test
        void shouldMeasureAgainstNegativeBaseline() {
            // -50 -> -100 is a 100% change
            assertThat(ThresholdCondition.PERCENT_CHANGE.isSatisfied(bd("-100"), bd("99"), bd("-50"))).isTrue();
        }
    }

    @Test
    void shouldResolveWireValues() {
        assertThat(ThresholdCondition.fromWireValue("above_threshold")).contains(ThresholdCondition.ABOVE_THRESHOLD);
        assertThat(ThresholdCondition.fromWireValue("percent_change")).contains(ThresholdCondition.PERCENT_CHANGE);
        assertThat(ThresholdCondition.fromWireValue("trend_detection")).isEmpty();
        assertThat(ThresholdCondition.fromWireValue(null)).isEmpty();
    }

    @Test
    void shouldRenderMessagesPerCondition() {
        assertThat(ThresholdCondition.ABOVE_THRESHOLD.message("Revenue", bd("150"), bd("100")))
                .isEqualTo("KPI \"Revenue\" value 150 exceeded threshold 100");
        assertThat(ThresholdCondition.BELOW_THRESHOLD.message("Revenue", bd("50"), bd("100")))
                .isEqualTo("KPI \"Revenue\" value 50 dropped below threshold 100");
        assertThat(ThresholdCondition.EQUALS.message("Revenue", bd("100"), bd("100")))
                .isEqualTo("KPI \"Revenue\" value 100 equals threshold 100");
        assertThat(ThresholdCondition.PERCENT_CHANGE.message("Revenue", bd("130"), bd("25")))
                .isEqualTo("KPI \"Revenue\" changed by more than 25% (current: 130)");
    }
}
