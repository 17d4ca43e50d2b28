package com.reportalert.engine.infrastructure.db.converter;

import com.reportalert.engine.domain.delivery.DeliveryStatus;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class DeliveryStatusConverter implements AttributeConverter<DeliveryStatus, String> {

    @Override
    public String convertToDatabaseColumn(DeliveryStatus status) {
        return status == null ? null : status.wireValue();
    }

    @Override
    public DeliveryStatus convertToEntityAttribute(String value) {
        if (value == null) {
            return null;
        }
        return DeliveryStatus.fromWireValue(value)
                .orElseThrow(() -> new IllegalStateException("Unknown delivery status: " + value));
    }
}
