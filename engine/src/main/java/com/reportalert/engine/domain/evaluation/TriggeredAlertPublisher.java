package com.reportalert.engine.domain.evaluation;

import com.reportalert.common.event.AlertTriggered;

public interface TriggeredAlertPublisher {

    void publish(AlertTriggered event);
}
