package com.platform.gitops.source;

import java.nio.file.Path;

/**
 * A fetched, content addressed artifact: local root directory plus its revision string.
 */
public record SourceArtifact(Path artifactPath, String revision) {
}
