package com.platform.gitops.model;

import jakarta.validation.constraints.NotBlank;

/**
 * An object explicitly included in the health assessment.
 */
public record HealthCheckReference(
    @NotBlank String apiVersion,
    @NotBlank String kind,
    @NotBlank String name,
    String namespace
) {

    public ObjectIdentifier toIdentifier(String defaultNamespace) {
        String ns = namespace == null || namespace.isBlank() ? defaultNamespace : namespace;
        return ObjectIdentifier.of(apiVersion, kind, ns, name);
    }
}
