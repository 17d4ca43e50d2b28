package com.reportalert.engine.domain.rule;

import java.util.List;
import java.util.Optional;

public interface ThresholdRuleRepository {

    ThresholdRule save(ThresholdRule rule);

    Optional<ThresholdRule> findById(String id);

    List<ThresholdRule> findByMetricId(String metricId);

    List<String> findMetricIdsWithActiveRules();

    void deleteById(String id);
}
