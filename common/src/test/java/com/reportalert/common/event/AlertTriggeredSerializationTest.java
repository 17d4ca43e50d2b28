package com.reportalert.common.event;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.reportalert.common.json.JacksonConfig;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class AlertTriggeredSerializationTest {

    private final ObjectMapper mapper = JacksonConfig.createObjectMapper();

    @Test
    void serializesWithSnakeCaseKeysAndIsoTimestamp() throws Exception {
        var event = AlertTriggered.builder()
                .historyId("ah_01HZ3X")
                .ruleId("alert_01HZ3W")
                .kpiId("kpi_roas")
                .kpiName("ROAS")
                .condition("above_threshold")
                .threshold(new BigDecimal("4.0"))
                .actualValue(new BigDecimal("4.25"))
                .message("KPI \"ROAS\" value 4.25 exceeded threshold 4.0")
                .channels(List.of("email", "slack"))
                .recipients(List.of("ops@example.com"))
                .triggeredAt(Instant.parse("2026-03-01T09:00:00Z"))
                .build();

        var json = mapper.writeValueAsString(event);

        assertThat(json).contains("\"history_id\":\"ah_01HZ3X\"");
        assertThat(json).contains("\"kpi_id\":\"kpi_roas\"");
        assertThat(json).contains("\"actual_value\":4.25");
        assertThat(json).contains("\"triggered_at\":\"2026-03-01T09:00:00Z\"");

        var deserialized = mapper.readValue(json, AlertTriggered.class);
        assertThat(deserialized.ruleId()).isEqualTo("alert_01HZ3W");
        assertThat(deserialized.actualValue()).isEqualByComparingTo("4.25");
        assertThat(deserialized.channels()).containsExactly("email", "slack");
        assertThat(deserialized.triggeredAt()).isEqualTo(event.triggeredAt());
    }

    @Test
    void ignoresUnknownProperties() throws Exception {
        var json = """
                {"rule_id":"alert_1","kpi_id":"kpi_1","schema_version":3}
                """;

        var deserialized = mapper.readValue(json, AlertTriggered.class);

        assertThat(deserialized.ruleId()).isEqualTo("alert_1");
        assertThat(deserialized.kpiId()).isEqualTo("kpi_1");
    }
}
