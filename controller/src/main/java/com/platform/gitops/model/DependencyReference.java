package com.platform.gitops.model;

import jakarta.validation.constraints.NotBlank;

/**
 * Names another unit that must be ready before the referring unit builds.
 */
public record DependencyReference(
    String namespace,
    @NotBlank String name
) {

    public UnitKey resolve(String defaultNamespace) {
        String ns = namespace == null || namespace.isBlank() ? defaultNamespace : namespace;
        return UnitKey.of(ns, name);
    }
}
