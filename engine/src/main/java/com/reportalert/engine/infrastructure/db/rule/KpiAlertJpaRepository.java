package com.reportalert.engine.infrastructure.db.rule;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface KpiAlertJpaRepository extends JpaRepository<KpiAlertEntity, String> {

    List<KpiAlertEntity> findByMetricIdOrderByCreatedAtAsc(String metricId);

    @Query("SELECT DISTINCT a.metricId FROM KpiAlertEntity a WHERE a.active = true ORDER BY a.metricId")
    List<String> findMetricIdsWithActiveRules();
}
