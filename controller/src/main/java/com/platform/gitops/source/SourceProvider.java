package com.platform.gitops.source;

import com.platform.gitops.model.SourceReference;

/**
 * Supplies the artifact behind a source reference.
 */
public interface SourceProvider {

    /**
     * @throws SourceUnavailableException when the source is unknown or has no artifact yet
     */
    SourceArtifact fetchSource(SourceReference ref);
}
