package com.platform.gitops.source;

import java.nio.file.Path;

/**
 * Resolves user supplied build paths inside an artifact root.
 */
public final class SecurePaths {

    private SecurePaths() {
    }

    /**
     * Joins {@code relative} onto {@code root}. Leading slashes are treated as relative to the
     * root; a result outside the root is rejected.
     *
     * @throws OverlayBuildException when the path escapes the root
     */
    public static Path join(Path root, String relative) {
        Path base = root.toAbsolutePath().normalize();
        if (relative == null || relative.isBlank()) {
            return base;
        }
        String trimmed = relative.strip();
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        Path resolved = base.resolve(trimmed).normalize();
        if (!resolved.startsWith(base)) {
            throw new OverlayBuildException("path '" + relative + "' escapes the artifact root");
        }
        return resolved;
    }
}
