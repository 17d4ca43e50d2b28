package com.reportalert.engine.application.controller;

import static com.reportalert.engine.fixtures.EngineFixtures.kpi;
import static com.reportalert.engine.fixtures.EngineFixtures.rule;
import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.reportalert.engine.BaseIntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

class AlertEvaluationControllerTest extends BaseIntegrationTest {

    @Autowired
    MockMvc mockMvc;

    @BeforeEach
    void setUpRules() {
        kpiJpaRepository.save(kpi("kpi_rev", "Revenue"));
        kpiAlertJpaRepository.save(rule("alert_high", "kpi_rev", "above_threshold", "100"));
        kpiAlertJpaRepository.save(rule("alert_swing", "kpi_rev", "percent_change", "20"));
    }

    @Test
    void shouldTriggerAndRecordHistory() throws Exception {
        mockMvc.perform(post("/api/v1/kpis/kpi_rev/evaluate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"value\": 150}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.kpiId", is("kpi_rev")))
                .andExpect(jsonPath("$.kpiName", is("Revenue")))
                .andExpect(jsonPath("$.alertsChecked", is(2)))
                .andExpect(jsonPath("$.triggeredCount", is(1)))
                .andExpect(jsonPath("$.triggeredAlerts[0].alertId", is("alert_high")))
                .andExpect(jsonPath("$.triggeredAlerts[0].message",
                        is("KPI \"Revenue\" value 150 exceeded threshold 100")))
                .andExpect(jsonPath("$.triggeredAlerts[0].historyId", startsWith("ah_")));

        assertThat(alertHistoryJpaRepository.count()).isEqualTo(1);

        mockMvc.perform(get("/api/v1/kpis/kpi_rev/alert-history"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].alertId", is("alert_high")))
                .andExpect(jsonPath("$[0].kpiId", is("kpi_rev")));
    }

    @Test
    void shouldFirePercentChangeAgainstBaseline() throws Exception {
        mockMvc.perform(post("/api/v1/kpis/kpi_rev/evaluate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"value\": 60, \"baseline\": 80}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.triggeredCount", is(1)))
                .andExpect(jsonPath("$.triggeredAlerts[0].alertId", is("alert_swing")));
    }

    @Test
    void shouldReturn404ForUnknownKpi() throws Exception {
        mockMvc.perform(post("/api/v1/kpis/kpi_missing/evaluate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"value\": 1}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code", is(ErrorCodes.KPI_NOT_FOUND)));
    }

    @Test
    void shouldEvaluateBatchWithPerEntryErrors() throws Exception {
        mockMvc.perform(post("/api/v1/alerts/evaluate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                    "readings": [
                                        {"kpiId": "kpi_rev", "value": 101},
                                        {"kpiId": "kpi_missing", "value": 5},
                                        {"kpiId": "kpi_rev", "value": 99}
                                    ]
                                }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(3)))
                .andExpect(jsonPath("$[0].triggeredCount", is(1)))
                .andExpect(jsonPath("$[1].kpiId", is("kpi_missing")))
                .andExpect(jsonPath("$[1].error", is("KPI kpi_missing not found")))
                .andExpect(jsonPath("$[2].triggeredCount", is(0)));
    }

    @Test
    void shouldRejectEmptyBatch() throws Exception {
        mockMvc.perform(post("/api/v1/alerts/evaluate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"readings\": []}"))
                .andExpect(status().isBadRequest());
    }
}
