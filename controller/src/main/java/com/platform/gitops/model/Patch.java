package com.platform.gitops.model;

import jakarta.validation.constraints.NotBlank;

/**
 * Inline strategic merge or JSON6902 patch with an optional target selector.
 * The overlay renderer interprets it; the engine only passes it through.
 */
public record Patch(
    @NotBlank String patch,
    Selector target
) {

    public record Selector(
        String group,
        String version,
        String kind,
        String name,
        String namespace,
        String labelSelector,
        String annotationSelector
    ) {
    }
}
