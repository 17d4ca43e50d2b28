package com.reportalert.engine.domain.trigger;

import java.util.List;

public interface AlertTriggerRepository {

    AlertTrigger save(AlertTrigger trigger);

    /**
     * Most recent triggers first.
     */
    List<AlertTrigger> findByMetricId(String metricId, int limit);
}
