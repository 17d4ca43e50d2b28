package com.reportalert.engine.application.job;

import com.reportalert.engine.application.service.AlertEvaluationHandler;
import com.reportalert.engine.domain.evaluation.EvaluationResult;
import com.reportalert.engine.domain.evaluation.MetricBaselineCache;
import com.reportalert.engine.domain.evaluation.MetricReading;
import com.reportalert.engine.domain.metric.MetricReader;
import com.reportalert.engine.domain.rule.ThresholdRuleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Periodic KPI sweep: reads the current value of every KPI that has an active alert
 * rule and evaluates it, using the previous sweep's value as the percent-change baseline.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MetricSweepJob {

    private final ThresholdRuleRepository ruleRepository;
    private final MetricReader metricReader;
    private final MetricBaselineCache baselineCache;
    private final AlertEvaluationHandler evaluationHandler;

    @Scheduled(cron = "${engine.alerts.sweep-cron}", zone = "${engine.alerts.sweep-timezone}")
    public void sweep() {
        var metricIds = ruleRepository.findMetricIdsWithActiveRules();
        if (metricIds.isEmpty()) {
            log.debug("KPI sweep: no KPI has an active alert rule");
            return;
        }

        var readings = new ArrayList<MetricReading>(metricIds.size());
        var unreadable = 0;
        for (var metricId : metricIds) {
            try {
                var value = metricReader.readMetricValue(metricId);
                if (value == null) {
                    unreadable++;
                    continue;
                }
                readings.add(new MetricReading(metricId, value, baselineCache.swap(metricId, value)));
            } catch (RuntimeException e) {
                unreadable++;
                log.warn("KPI sweep: cannot read KPI {}: {}", metricId, e.getMessage());
            }
        }

        var results = evaluationHandler.evaluateMany(readings);
        log.info("KPI sweep complete: {} KPI(s) evaluated, {} unreadable, {} failed, {} alert(s) triggered",
                readings.size(), unreadable, countFailed(results), countTriggered(results));
    }

    private static long countFailed(List<EvaluationResult> results) {
        return results.stream().filter(EvaluationResult::isFailed).count();
    }

    private static int countTriggered(List<EvaluationResult> results) {
        return results.stream().mapToInt(EvaluationResult::triggeredCount).sum();
    }
}
