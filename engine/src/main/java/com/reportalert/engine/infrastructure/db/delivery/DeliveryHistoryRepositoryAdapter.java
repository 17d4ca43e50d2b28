package com.reportalert.engine.infrastructure.db.delivery;

import com.reportalert.engine.domain.delivery.DeliveryAttempt;
import com.reportalert.engine.domain.delivery.DeliveryHistoryRepository;
import com.reportalert.engine.domain.delivery.DeliveryStatus;
import com.reportalert.engine.infrastructure.db.delivery.mapper.DeliveryHistoryEntityMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Slf4j
@Repository
@RequiredArgsConstructor
public class DeliveryHistoryRepositoryAdapter implements DeliveryHistoryRepository {

    private final DeliveryHistoryJpaRepository jpaRepository;
    private final DeliveryHistoryEntityMapper mapper;

    @Override
    @Transactional
    public DeliveryAttempt create(DeliveryAttempt attempt) {
        var saved = jpaRepository.save(mapper.toEntity(attempt));
        return mapper.toDomain(saved);
    }

    @Override
    @Transactional
    public boolean markSucceeded(String attemptId, long fileSize) {
        return finalizeAttempt(attemptId, DeliveryStatus.SUCCESS, null, fileSize);
    }

    @Override
    @Transactional
    public boolean markFailed(String attemptId, String errorMessage) {
        return finalizeAttempt(attemptId, DeliveryStatus.FAILED, errorMessage, null);
    }

    @Override
    @Transactional(readOnly = true)
    public List<DeliveryAttempt> findByArtifactId(String artifactId, int limit) {
        return jpaRepository.findByArtifactIdOrderByDeliveredAtDesc(artifactId, PageRequest.of(0, limit)).stream()
                .map(mapper::toDomain)
                .toList();
    }

    private boolean finalizeAttempt(String attemptId, DeliveryStatus status, String errorMessage, Long fileSize) {
        var updated = jpaRepository.finalizeAttempt(attemptId, DeliveryStatus.PENDING, status, errorMessage, fileSize);
        if (updated == 0) {
            log.debug("Delivery attempt {} already finalized, ignoring {}", attemptId, status.wireValue());
            return false;
        }
        return true;
    }
}
