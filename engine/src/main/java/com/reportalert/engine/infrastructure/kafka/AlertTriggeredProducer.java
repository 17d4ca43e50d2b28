package com.reportalert.engine.infrastructure.kafka;

import com.reportalert.common.event.AlertTriggered;
import com.reportalert.common.kafka.KafkaTopics;
import com.reportalert.engine.domain.evaluation.TriggeredAlertPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Produces AlertTriggered events to the kpi-alert-triggers topic, keyed by kpi_id.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AlertTriggeredProducer implements TriggeredAlertPublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;

    @Override
    public void publish(AlertTriggered event) {
        try {
            kafkaTemplate.send(KafkaTopics.KPI_ALERT_TRIGGERS, event.kpiId(), event)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            log.error("Failed to produce AlertTriggered for rule {}: {}",
                                    event.ruleId(), ex.getMessage());
                        } else {
                            log.debug("Produced AlertTriggered for rule {} to partition {}",
                                    event.ruleId(),
                                    result.getRecordMetadata().partition());
                        }
                    });
        } catch (RuntimeException e) {
            log.error("Failed to send AlertTriggered for rule {}: {}", event.ruleId(), e.getMessage());
        }
    }
}
