package com.reportalert.engine.domain.rule;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Arrays;
import java.util.Optional;

public enum ThresholdCondition {

    ABOVE_THRESHOLD("above_threshold"),
    BELOW_THRESHOLD("below_threshold"),
    EQUALS("equals"),
    PERCENT_CHANGE("percent_change");

    private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);

    private final String wireValue;

    ThresholdCondition(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static Optional<ThresholdCondition> fromWireValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(c -> c.wireValue.equals(value))
                .findFirst();
    }

    /**
     * Whether {@code value} satisfies this condition. Percent change is measured against
     * {@code baseline} and never fires without a non-zero baseline.
     */
    public boolean isSatisfied(BigDecimal value, BigDecimal threshold, BigDecimal baseline) {
        return switch (this) {
            case ABOVE_THRESHOLD -> value.compareTo(threshold) > 0;
            case BELOW_THRESHOLD -> value.compareTo(threshold) < 0;
            case EQUALS -> value.compareTo(threshold) == 0;
            case PERCENT_CHANGE -> {
                if (baseline == null || baseline.signum() == 0) {
                    yield false;
                }
                var change = value.subtract(baseline)
                        .divide(baseline.abs(), MathContext.DECIMAL64)
                        .abs()
                        .multiply(ONE_HUNDRED);
                yield change.compareTo(threshold) > 0;
            }
        };
    }

    public String message(String metricName, BigDecimal value, BigDecimal threshold) {
        var v = value.stripTrailingZeros().toPlainString();
        var t = threshold.stripTrailingZeros().toPlainString();
        return switch (this) {
            case ABOVE_THRESHOLD -> "KPI \"" + metricName + "\" value " + v + " exceeded threshold " + t;
            case BELOW_THRESHOLD -> "KPI \"" + metricName + "\" value " + v + " dropped below threshold " + t;
            case EQUALS -> "KPI \"" + metricName + "\" value " + v + " equals threshold " + t;
            case PERCENT_CHANGE -> "KPI \"" + metricName + "\" changed by more than " + t + "% (current: " + v + ")";
        };
    }
}
