package com.reportalert.engine.infrastructure.db.rule;

import com.reportalert.engine.domain.rule.ThresholdRule;
import com.reportalert.engine.domain.rule.ThresholdRuleRepository;
import com.reportalert.engine.infrastructure.db.rule.mapper.KpiAlertEntityMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class ThresholdRuleRepositoryAdapter implements ThresholdRuleRepository {

    private final KpiAlertJpaRepository jpaRepository;
    private final KpiAlertEntityMapper mapper;

    @Override
    @Transactional
    public ThresholdRule save(ThresholdRule rule) {
        var saved = jpaRepository.save(mapper.toEntity(rule));
        return mapper.toDomain(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ThresholdRule> findById(String id) {
        return jpaRepository.findById(id).map(mapper::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ThresholdRule> findByMetricId(String metricId) {
        return jpaRepository.findByMetricIdOrderByCreatedAtAsc(metricId).stream()
                .map(mapper::toDomain)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<String> findMetricIdsWithActiveRules() {
        return jpaRepository.findMetricIdsWithActiveRules();
    }

    @Override
    @Transactional
    public void deleteById(String id) {
        jpaRepository.deleteById(id);
    }
}
