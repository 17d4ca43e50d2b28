package com.reportalert.engine.application.config;

import com.reportalert.engine.domain.evaluation.MetricBaselineCache;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MetricsConfig {

    @Bean
    public Counter deliveriesSucceededCounter(MeterRegistry registry) {
        return Counter.builder("engine.deliveries.succeeded")
                .description("Report deliveries that reached their recipients")
                .register(registry);
    }

    @Bean
    public Counter deliveriesFailedCounter(MeterRegistry registry) {
        return Counter.builder("engine.deliveries.failed")
                .description("Report deliveries recorded as failed")
                .register(registry);
    }

    @Bean
    public Counter schedulerTicksCounter(MeterRegistry registry) {
        return Counter.builder("engine.scheduler.ticks")
                .description("Scheduler ticks that ran a sweep")
                .register(registry);
    }

    @Bean
    public Counter schedulerTicksSkippedCounter(MeterRegistry registry) {
        return Counter.builder("engine.scheduler.ticks.skipped")
                .description("Scheduler ticks skipped because the previous tick was still running")
                .register(registry);
    }

    @Bean
    public Counter alertsTriggeredCounter(MeterRegistry registry) {
        return Counter.builder("engine.alerts.triggered")
                .description("Threshold rules satisfied by a KPI reading")
                .register(registry);
    }

    @Bean
    public Counter alertRulesCreatedCounter(MeterRegistry registry) {
        return Counter.builder("engine.alert-rules.created")
                .description("Threshold rules created")
                .register(registry);
    }

    @Bean
    public Gauge baselineMetricsGauge(MeterRegistry registry, MetricBaselineCache baselineCache) {
        return Gauge.builder("engine.alerts.baselines", baselineCache::size)
                .description("KPIs with a remembered baseline reading")
                .register(registry);
    }
}
