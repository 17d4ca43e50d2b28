package com.reportalert.engine.domain.artifact;

import java.util.List;

/**
 * Hands a rendered report to its recipients (mail, webhook, ...). Implementations throw
 * {@link com.reportalert.engine.domain.exceptions.ArtifactDeliveryException} on failure.
 */
public interface ArtifactDeliverer {

    void deliver(ScheduledArtifact artifact, byte[] content, List<String> recipients);
}
