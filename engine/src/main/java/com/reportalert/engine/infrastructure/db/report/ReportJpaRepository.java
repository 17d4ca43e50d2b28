package com.reportalert.engine.infrastructure.db.report;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface ReportJpaRepository extends JpaRepository<ReportEntity, String> {

    List<ReportEntity> findByScheduledTrueOrderByIdAsc();

    @Modifying
    @Query("UPDATE ReportEntity r SET r.lastSentAt = :sentAt, "
            + "r.sendCount = COALESCE(r.sendCount, 0) + 1 WHERE r.id = :id")
    int markSent(@Param("id") String id, @Param("sentAt") Instant sentAt);

    @Modifying
    @Query("UPDATE ReportEntity r SET r.nextRunAt = :nextRunAt WHERE r.id = :id")
    int updateNextRunAt(@Param("id") String id, @Param("nextRunAt") Instant nextRunAt);
}
