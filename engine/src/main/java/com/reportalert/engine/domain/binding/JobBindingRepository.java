package com.reportalert.engine.domain.binding;

import com.reportalert.engine.domain.delivery.DeliveryStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface JobBindingRepository {

    JobBinding save(JobBinding binding);

    Optional<JobBinding> findByArtifactId(String artifactId);

    /**
     * Active bindings whose {@code nextRunAt} is at or before {@code now}.
     */
    List<JobBinding> findDue(Instant now);

    List<JobBinding> findAll();

    void deleteByArtifactId(String artifactId);

    /**
     * Stores the run times and the result of the last run in one update.
     */
    int recordRun(String id, Instant lastRunAt, Instant nextRunAt, DeliveryStatus lastStatus, String lastError);
}
