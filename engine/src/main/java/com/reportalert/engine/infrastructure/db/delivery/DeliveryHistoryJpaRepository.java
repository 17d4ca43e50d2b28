package com.reportalert.engine.infrastructure.db.delivery;

import com.reportalert.engine.domain.delivery.DeliveryStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface DeliveryHistoryJpaRepository extends JpaRepository<DeliveryHistoryEntity, String> {

    List<DeliveryHistoryEntity> findByArtifactIdOrderByDeliveredAtDesc(String artifactId, Pageable pageable);

    /**
     * Moves an attempt out of {@code current}; zero rows updated means it already left it.
     */
    @Modifying
    @Query("UPDATE DeliveryHistoryEntity h SET h.status = :newStatus, h.errorMessage = :errorMessage, "
            + "h.fileSize = :fileSize WHERE h.id = :id AND h.status = :current")
    int finalizeAttempt(@Param("id") String id,
                        @Param("current") DeliveryStatus current,
                        @Param("newStatus") DeliveryStatus newStatus,
                        @Param("errorMessage") String errorMessage,
                        @Param("fileSize") Long fileSize);
}
