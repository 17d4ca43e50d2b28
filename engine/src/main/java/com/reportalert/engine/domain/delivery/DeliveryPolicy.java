package com.reportalert.engine.domain.delivery;

import java.time.Duration;

/**
 * @param attemptTimeout upper bound for a single render or deliver call
 */
public record DeliveryPolicy(Duration attemptTimeout) {
}
