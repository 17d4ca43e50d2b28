package com.reportalert.engine.domain.metric;

import java.util.Optional;

public interface MetricRepository {

    Optional<Metric> findById(String id);
}
