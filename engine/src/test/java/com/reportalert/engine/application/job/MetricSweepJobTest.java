package com.reportalert.engine.application.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.times;

import com.reportalert.engine.application.service.AlertEvaluationHandler;
import com.reportalert.engine.domain.evaluation.MetricBaselineCache;
import com.reportalert.engine.domain.evaluation.MetricReading;
import com.reportalert.engine.domain.exceptions.MetricReadException;
import com.reportalert.engine.domain.metric.MetricReader;
import com.reportalert.engine.domain.rule.ThresholdRuleRepository;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MetricSweepJobTest {

    @Mock
    ThresholdRuleRepository ruleRepository;

    @Mock
    MetricReader metricReader;

    @Mock
    AlertEvaluationHandler evaluationHandler;

    private MetricBaselineCache baselineCache;
    private MetricSweepJob job;

    @BeforeEach
    void setUp() {
        baselineCache = new MetricBaselineCache();
        job = new MetricSweepJob(ruleRepository, metricReader, baselineCache, evaluationHandler);
    }

    @Test
    void shouldUsePreviousSweepValueAsBaseline() {
        // given
        given(ruleRepository.findMetricIdsWithActiveRules()).willReturn(List.of("k1"));
        given(metricReader.readMetricValue("k1")).willReturn(new BigDecimal("100"), new BigDecimal("130"));
        given(evaluationHandler.evaluateMany(anyList())).willReturn(List.of());

        // when
        job.sweep();
        job.sweep();

        // then
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<MetricReading>> captor = ArgumentCaptor.forClass(List.class);
        then(evaluationHandler).should(times(2)).evaluateMany(captor.capture());
        assertThat(captor.getAllValues().get(0))
                .containsExactly(new MetricReading("k1", new BigDecimal("100"), null));
        assertThat(captor.getAllValues().get(1))
                .containsExactly(new MetricReading("k1", new BigDecimal("130"), new BigDecimal("100")));
    }

    @Test
    void shouldLeaveOutUnreadableKpis() {
        // given
        given(ruleRepository.findMetricIdsWithActiveRules()).willReturn(List.of("k1", "k2", "k3"));
        given(metricReader.readMetricValue("k1")).willThrow(new MetricReadException("source offline"));
        given(metricReader.readMetricValue("k2")).willReturn(null);
        given(metricReader.readMetricValue("k3")).willReturn(BigDecimal.TEN);
        given(evaluationHandler.evaluateMany(anyList())).willReturn(List.of());

        // when
        job.sweep();

        // then
        then(evaluationHandler).should().evaluateMany(List.of(new MetricReading("k3", BigDecimal.TEN, null)));
        assertThat(baselineCache.size()).isEqualTo(1);
    }

    @Test
    void shouldSkipSweepWithoutActiveRules() {
        // given
        given(ruleRepository.findMetricIdsWithActiveRules()).willReturn(List.of());

        // when
        job.sweep();

        // then
        then(metricReader).shouldHaveNoInteractions();
        then(evaluationHandler).shouldHaveNoInteractions();
    }
}
