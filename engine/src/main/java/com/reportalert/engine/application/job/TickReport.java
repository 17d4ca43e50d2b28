package com.reportalert.engine.application.job;

import com.reportalert.engine.domain.delivery.DeliveryOutcome;

import java.time.Instant;
import java.util.List;

/**
 * Summary of one scheduler tick. {@code dueByBinding} counts reports whose cron binding
 * fired; {@code reconciled} counts reports added only by interval reconciliation.
 */
public record TickReport(
        Instant startedAt,
        boolean overlapped,
        int dueByBinding,
        int reconciled,
        int delivered,
        int failed,
        int skipped,
        List<DeliveryOutcome> outcomes
) {

    public static TickReport overlapped(Instant startedAt) {
        return new TickReport(startedAt, true, 0, 0, 0, 0, 0, List.of());
    }

    public static TickReport of(Instant startedAt, int dueByBinding, int reconciled, List<DeliveryOutcome> outcomes) {
        var delivered = count(outcomes, DeliveryOutcome.Result.DELIVERED);
        var failed = count(outcomes, DeliveryOutcome.Result.FAILED);
        var skipped = count(outcomes, DeliveryOutcome.Result.SKIPPED);
        return new TickReport(startedAt, false, dueByBinding, reconciled, delivered, failed, skipped,
                List.copyOf(outcomes));
    }

    public int processed() {
        return outcomes.size();
    }

    private static int count(List<DeliveryOutcome> outcomes, DeliveryOutcome.Result result) {
        return (int) outcomes.stream().filter(o -> o.result() == result).count();
    }
}
