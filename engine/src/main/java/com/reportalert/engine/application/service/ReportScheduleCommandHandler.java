package com.reportalert.engine.application.service;

import com.reportalert.engine.application.config.EngineProperties;
import com.reportalert.engine.domain.artifact.ArtifactRepository;
import com.reportalert.engine.domain.artifact.Frequency;
import com.reportalert.engine.domain.artifact.ScheduleConfig;
import com.reportalert.engine.domain.binding.JobBinding;
import com.reportalert.engine.domain.binding.JobBindingService;
import com.reportalert.engine.domain.delivery.DeliveryAttempt;
import com.reportalert.engine.domain.delivery.DeliveryHistoryRepository;
import com.reportalert.engine.domain.delivery.DeliveryOutcome;
import com.reportalert.engine.domain.delivery.DeliveryPipeline;
import com.reportalert.engine.domain.exceptions.ReportNotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Operator commands on report schedules, job bindings and deliveries.
 */
@Component
@RequiredArgsConstructor
public class ReportScheduleCommandHandler {

    private final JobBindingService jobBindingService;
    private final DeliveryPipeline deliveryPipeline;
    private final ArtifactRepository artifactRepository;
    private final DeliveryHistoryRepository historyRepository;
    private final EngineProperties properties;

    @Transactional
    public Optional<JobBinding> schedule(String reportId, Frequency frequency, ScheduleConfig config) {
        return jobBindingService.schedule(reportId, frequency, config);
    }

    @Transactional
    public void unschedule(String reportId) {
        jobBindingService.unschedule(reportId);
    }

    @Transactional
    public JobBinding pause(String reportId) {
        return jobBindingService.pause(reportId);
    }

    @Transactional
    public JobBinding resume(String reportId) {
        return jobBindingService.resume(reportId);
    }

    @Transactional(readOnly = true)
    public List<JobBinding> listBindings() {
        return jobBindingService.listBindings();
    }

    /**
     * Runs outside a transaction: the pending attempt must be visible before the
     * collaborators are called.
     */
    public DeliveryOutcome deliverNow(String reportId) {
        artifactRepository.findById(reportId)
                .orElseThrow(() -> ReportNotFoundException.of(reportId));
        return deliveryPipeline.deliverNow(reportId);
    }

    @Transactional(readOnly = true)
    public List<DeliveryAttempt> deliveryHistory(String reportId) {
        artifactRepository.findById(reportId)
                .orElseThrow(() -> ReportNotFoundException.of(reportId));
        return historyRepository.findByArtifactId(reportId, properties.delivery().historyLimit());
    }
}
