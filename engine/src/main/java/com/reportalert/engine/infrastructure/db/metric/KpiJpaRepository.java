package com.reportalert.engine.infrastructure.db.metric;

import org.springframework.data.jpa.repository.JpaRepository;

public interface KpiJpaRepository extends JpaRepository<KpiEntity, String> {
}
