package com.reportalert.engine.infrastructure.db.metric;

import com.reportalert.engine.domain.metric.Metric;
import com.reportalert.engine.domain.metric.MetricRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class MetricRepositoryAdapter implements MetricRepository {

    private final KpiJpaRepository jpaRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<Metric> findById(String id) {
        return jpaRepository.findById(id)
                .map(entity -> new Metric(entity.getId(), entity.getName()));
    }
}
