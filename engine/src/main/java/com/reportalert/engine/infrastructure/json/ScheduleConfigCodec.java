package com.reportalert.engine.infrastructure.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reportalert.common.json.JacksonConfig;
import com.reportalert.engine.domain.artifact.Frequency;
import com.reportalert.engine.domain.artifact.ScheduleConfig;
import com.reportalert.engine.domain.exceptions.InvalidScheduleException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Translates the {@code reports.schedule_config} JSON document
 * ({@code {"frequency":"weekly","time":"09:00","dayOfWeek":"monday","dayOfMonth":1,"timezone":"..."}})
 * to and from {@link ScheduleConfig}. Unreadable documents are logged and read as empty.
 */
@Slf4j
@Component
public class ScheduleConfigCodec {

    private final ObjectMapper objectMapper = JacksonConfig.createObjectMapper();

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ScheduleDocument(String frequency, String time, String dayOfWeek, Integer dayOfMonth, String timezone) {
    }

    public ScheduleConfig fromJson(String json) {
        if (json == null || json.isBlank()) {
            return ScheduleConfig.EMPTY;
        }
        try {
            var document = objectMapper.readValue(json, ScheduleDocument.class);
            return ScheduleConfig.parse(document.time(), document.dayOfWeek(), document.dayOfMonth(), document.timezone());
        } catch (JsonProcessingException | InvalidScheduleException e) {
            log.warn("Ignoring unreadable schedule_config {}: {}", json, e.getMessage());
            return ScheduleConfig.EMPTY;
        }
    }

    public String toJson(Frequency frequency, ScheduleConfig config) {
        var schedule = config != null ? config : ScheduleConfig.EMPTY;
        var document = new ScheduleDocument(
                frequency != null ? frequency.wireValue() : null,
                schedule.formattedTimeOfDay(),
                schedule.dayOfWeek() != null ? schedule.dayOfWeek().name().toLowerCase(Locale.ROOT) : null,
                schedule.dayOfMonth(),
                schedule.timezone() != null ? schedule.timezone().getId() : null);
        try {
            return objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize schedule config", e);
        }
    }
}
