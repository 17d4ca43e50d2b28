package com.reportalert.engine.infrastructure.db.binding;

import com.reportalert.engine.domain.delivery.DeliveryStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ScheduledJobJpaRepository extends JpaRepository<ScheduledJobEntity, String> {

    Optional<ScheduledJobEntity> findByArtifactId(String artifactId);

    @Query("SELECT j FROM ScheduledJobEntity j WHERE j.active = true "
            + "AND j.nextRunAt IS NOT NULL AND j.nextRunAt <= :now ORDER BY j.nextRunAt ASC")
    List<ScheduledJobEntity> findDue(@Param("now") Instant now);

    List<ScheduledJobEntity> findAllByOrderByArtifactIdAsc();

    @Modifying
    @Query("DELETE FROM ScheduledJobEntity j WHERE j.artifactId = :artifactId")
    int deleteByArtifactId(@Param("artifactId") String artifactId);

    @Modifying
    @Query("UPDATE ScheduledJobEntity j SET j.lastRunAt = :lastRunAt, j.nextRunAt = :nextRunAt, "
            + "j.lastStatus = :lastStatus, j.lastError = :lastError, j.updatedAt = :lastRunAt "
            + "WHERE j.id = :id")
    int recordRun(@Param("id") String id,
                  @Param("lastRunAt") Instant lastRunAt,
                  @Param("nextRunAt") Instant nextRunAt,
                  @Param("lastStatus") DeliveryStatus lastStatus,
                  @Param("lastError") String lastError);
}
