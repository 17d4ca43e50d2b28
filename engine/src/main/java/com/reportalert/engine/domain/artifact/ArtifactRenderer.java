package com.reportalert.engine.domain.artifact;

/**
 * Produces the file for a report in its delivery format. Implementations throw
 * {@link com.reportalert.engine.domain.exceptions.ArtifactRenderException} on failure.
 */
public interface ArtifactRenderer {

    byte[] render(ScheduledArtifact artifact);
}
