package com.reportalert.engine.domain.delivery;

import java.util.List;

/**
 * Append-only trail of delivery attempts. An attempt leaves {@code pending} exactly once;
 * the finalizing methods return {@code false} when the attempt was already finalized.
 */
public interface DeliveryHistoryRepository {

    DeliveryAttempt create(DeliveryAttempt attempt);

    boolean markSucceeded(String attemptId, long fileSize);

    boolean markFailed(String attemptId, String errorMessage);

    List<DeliveryAttempt> findByArtifactId(String artifactId, int limit);
}
