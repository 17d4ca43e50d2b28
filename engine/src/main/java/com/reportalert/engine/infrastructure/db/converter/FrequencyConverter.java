package com.reportalert.engine.infrastructure.db.converter;

import com.reportalert.engine.domain.artifact.Frequency;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads unknown or missing frequencies as daily, the interval used for them by
 * due-set reconciliation.
 */
@Slf4j
@Converter
public class FrequencyConverter implements AttributeConverter<Frequency, String> {

    @Override
    public String convertToDatabaseColumn(Frequency frequency) {
        return frequency == null ? null : frequency.wireValue();
    }

    @Override
    public Frequency convertToEntityAttribute(String value) {
        if (value == null) {
            return Frequency.DAILY;
        }
        return Frequency.fromWireValue(value).orElseGet(() -> {
            log.warn("Unknown report frequency '{}', treating as daily", value);
            return Frequency.DAILY;
        });
    }
}
