package com.reportalert.engine.domain.artifact;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ArtifactRepository {

    Optional<ScheduledArtifact> findById(String id);

    List<ScheduledArtifact> findScheduled();

    /**
     * Records a successful delivery: sets {@code lastSentAt} and increments the send count.
     */
    void markSent(String id, Instant sentAt);

    void updateSchedule(String id, Frequency frequency, ScheduleConfig scheduleConfig, boolean scheduled, Instant nextRunAt);

    void updateNextRunAt(String id, Instant nextRunAt);
}
