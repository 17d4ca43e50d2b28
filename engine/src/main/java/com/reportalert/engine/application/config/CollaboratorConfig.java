package com.reportalert.engine.application.config;

import com.reportalert.engine.domain.artifact.ArtifactDeliverer;
import com.reportalert.engine.domain.artifact.ArtifactRenderer;
import com.reportalert.engine.domain.metric.MetricReader;
import com.reportalert.engine.infrastructure.collaborator.UnconfiguredArtifactDeliverer;
import com.reportalert.engine.infrastructure.collaborator.UnconfiguredArtifactRenderer;
import com.reportalert.engine.infrastructure.collaborator.UnconfiguredMetricReader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Rendering, mail transport and KPI sources live outside this service. When a deployment
 * provides no bean for one of them, the fallbacks below fail every call so attempts are
 * recorded as failed rather than silently dropped.
 */
@Slf4j
@Configuration
public class CollaboratorConfig {

    @Bean
    @ConditionalOnMissingBean
    public ArtifactRenderer artifactRenderer() {
        log.warn("No ArtifactRenderer bean found, report deliveries will fail until one is configured");
        return new UnconfiguredArtifactRenderer();
    }

    @Bean
    @ConditionalOnMissingBean
    public ArtifactDeliverer artifactDeliverer() {
        log.warn("No ArtifactDeliverer bean found, report deliveries will fail until one is configured");
        return new UnconfiguredArtifactDeliverer();
    }

    @Bean
    @ConditionalOnMissingBean
    public MetricReader metricReader() {
        log.warn("No MetricReader bean found, the KPI sweep will skip every KPI");
        return new UnconfiguredMetricReader();
    }
}
