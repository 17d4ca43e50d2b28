package com.reportalert.engine.infrastructure.collaborator;

import com.reportalert.engine.domain.artifact.ArtifactRenderer;
import com.reportalert.engine.domain.artifact.ScheduledArtifact;
import com.reportalert.engine.domain.exceptions.ArtifactRenderException;

/**
 * Stands in until a real renderer bean is deployed; every attempt is recorded as failed.
 */
public class UnconfiguredArtifactRenderer implements ArtifactRenderer {

    @Override
    public byte[] render(ScheduledArtifact artifact) {
        throw new ArtifactRenderException("No report renderer configured");
    }
}
