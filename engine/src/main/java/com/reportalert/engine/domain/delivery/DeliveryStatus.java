package com.reportalert.engine.domain.delivery;

import java.util.Arrays;
import java.util.Optional;

public enum DeliveryStatus {

    PENDING("pending"),
    SUCCESS("success"),
    FAILED("failed");

    private final String wireValue;

    DeliveryStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static Optional<DeliveryStatus> fromWireValue(String value) {
        return Arrays.stream(values())
                .filter(s -> s.wireValue.equalsIgnoreCase(value))
                .findFirst();
    }
}
