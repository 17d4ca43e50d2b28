package com.reportalert.engine.domain.delivery;

class DeliveryAbandonedException extends RuntimeException {

    static final String MESSAGE = "Delivery abandoned: engine shutting down";

    DeliveryAbandonedException() {
        super(MESSAGE);
    }
}
