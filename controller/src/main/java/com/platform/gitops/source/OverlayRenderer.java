package com.platform.gitops.source;

import com.platform.gitops.model.Image;
import com.platform.gitops.model.Patch;

import java.nio.file.Path;
import java.util.List;

/**
 * Expands an overlay directory into a multi-document manifest stream.
 */
public interface OverlayRenderer {

    /**
     * @throws OverlayBuildException when the overlay cannot be built
     */
    byte[] renderOverlay(Path path, List<Patch> patches, List<Image> images, String targetNamespace);
}
