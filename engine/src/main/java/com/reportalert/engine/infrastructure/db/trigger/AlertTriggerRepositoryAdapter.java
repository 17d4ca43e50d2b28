package com.reportalert.engine.infrastructure.db.trigger;

import com.reportalert.engine.domain.trigger.AlertTrigger;
import com.reportalert.engine.domain.trigger.AlertTriggerRepository;
import com.reportalert.engine.infrastructure.db.trigger.mapper.AlertHistoryEntityMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Repository
@RequiredArgsConstructor
public class AlertTriggerRepositoryAdapter implements AlertTriggerRepository {

    private final AlertHistoryJpaRepository jpaRepository;
    private final AlertHistoryEntityMapper mapper;

    @Override
    @Transactional
    public AlertTrigger save(AlertTrigger trigger) {
        var saved = jpaRepository.save(mapper.toEntity(trigger));
        return mapper.toDomain(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public List<AlertTrigger> findByMetricId(String metricId, int limit) {
        return jpaRepository.findByMetricIdOrderByTriggeredAtDesc(metricId, PageRequest.of(0, limit)).stream()
                .map(mapper::toDomain)
                .toList();
    }
}
