package com.reportalert.engine.infrastructure.collaborator;

import com.reportalert.engine.domain.artifact.ArtifactDeliverer;
import com.reportalert.engine.domain.artifact.ScheduledArtifact;
import com.reportalert.engine.domain.exceptions.ArtifactDeliveryException;

import java.util.List;

public class UnconfiguredArtifactDeliverer implements ArtifactDeliverer {

    @Override
    public void deliver(ScheduledArtifact artifact, byte[] content, List<String> recipients) {
        throw new ArtifactDeliveryException("No report delivery channel configured");
    }
}
