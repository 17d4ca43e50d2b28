package com.reportalert.engine.domain.artifact;

import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;

public enum Frequency {

    REALTIME("realtime", Duration.ofHours(24)),
    HOURLY("hourly", Duration.ofHours(1)),
    DAILY("daily", Duration.ofHours(24)),
    WEEKLY("weekly", Duration.ofDays(7)),
    MONTHLY("monthly", Duration.ofDays(30)),
    ON_DEMAND("on_demand", null);

    private final String wireValue;
    private final Duration dueInterval;

    Frequency(String wireValue, Duration dueInterval) {
        this.wireValue = wireValue;
        this.dueInterval = dueInterval;
    }

    public String wireValue() {
        return wireValue;
    }

    /**
     * Minimum time between two automatic deliveries. Empty for {@link #ON_DEMAND},
     * which is never due automatically. Realtime has no interval of its own and uses
     * the 24 hour fallback.
     */
    public Optional<Duration> dueInterval() {
        return Optional.ofNullable(dueInterval);
    }

    public static Optional<Frequency> fromWireValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(f -> f.wireValue.equalsIgnoreCase(value.trim()))
                .findFirst();
    }
}
