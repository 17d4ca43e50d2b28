package com.reportalert.engine.domain.schedule;

import com.reportalert.engine.domain.artifact.Frequency;
import com.reportalert.engine.domain.artifact.ScheduledArtifact;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Interval-based reconciliation of "should this report have been sent by now",
 * independent of any cron binding. Catches reports whose binding is missing or
 * whose cron run was lost.
 */
@Component
public class DueSetResolver {

    public List<ScheduledArtifact> findDue(List<ScheduledArtifact> artifacts, Instant now) {
        return artifacts.stream()
                .filter(artifact -> isDue(artifact, now))
                .toList();
    }

    public boolean isDue(ScheduledArtifact artifact, Instant now) {
        if (!artifact.scheduled()) {
            return false;
        }
        var frequency = Objects.requireNonNullElse(artifact.frequency(), Frequency.DAILY);
        var interval = frequency.dueInterval();
        if (interval.isEmpty()) {
            return false;
        }
        if (artifact.lastSentAt() == null) {
            return true;
        }
        var elapsed = Duration.between(artifact.lastSentAt(), now);
        return elapsed.compareTo(interval.get()) >= 0;
    }
}
