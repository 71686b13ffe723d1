package com.platform.gitops.model;

import jakarta.validation.constraints.NotBlank;

/**
 * Image name, tag or digest override passed to the overlay renderer.
 */
public record Image(
    @NotBlank String name,
    String newName,
    String newTag,
    String digest
) {
}
