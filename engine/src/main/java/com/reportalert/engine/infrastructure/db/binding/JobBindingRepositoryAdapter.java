package com.reportalert.engine.infrastructure.db.binding;

import com.reportalert.engine.domain.binding.JobBinding;
import com.reportalert.engine.domain.binding.JobBindingRepository;
import com.reportalert.engine.domain.delivery.DeliveryStatus;
import com.reportalert.engine.infrastructure.db.binding.mapper.ScheduledJobEntityMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class JobBindingRepositoryAdapter implements JobBindingRepository {

    private final ScheduledJobJpaRepository jpaRepository;
    private final ScheduledJobEntityMapper mapper;

    @Override
    @Transactional
    public JobBinding save(JobBinding binding) {
        var saved = jpaRepository.save(mapper.toEntity(binding));
        return mapper.toDomain(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<JobBinding> findByArtifactId(String artifactId) {
        return jpaRepository.findByArtifactId(artifactId).map(mapper::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<JobBinding> findDue(Instant now) {
        return jpaRepository.findDue(now).stream()
                .map(mapper::toDomain)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<JobBinding> findAll() {
        return jpaRepository.findAllByOrderByArtifactIdAsc().stream()
                .map(mapper::toDomain)
                .toList();
    }

    @Override
    @Transactional
    public void deleteByArtifactId(String artifactId) {
        jpaRepository.deleteByArtifactId(artifactId);
    }

    @Override
    @Transactional
    public int recordRun(String id, Instant lastRunAt, Instant nextRunAt,
                         DeliveryStatus lastStatus, String lastError) {
        return jpaRepository.recordRun(id, lastRunAt, nextRunAt, lastStatus, lastError);
    }
}
