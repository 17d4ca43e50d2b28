package com.reportalert.engine.infrastructure.db.trigger;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AlertHistoryJpaRepository extends JpaRepository<AlertHistoryEntity, String> {

    List<AlertHistoryEntity> findByMetricIdOrderByTriggeredAtDesc(String metricId, Pageable pageable);
}
