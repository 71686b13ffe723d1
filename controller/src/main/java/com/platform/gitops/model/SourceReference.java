package com.platform.gitops.model;

import jakarta.validation.constraints.NotBlank;

/**
 * Reference to the source artifact a unit builds from.
 * The namespace defaults to the namespace of the referring unit.
 */
public record SourceReference(
    @NotBlank String kind,
    @NotBlank String name,
    String namespace
) {

    public SourceReference withDefaultNamespace(String defaultNamespace) {
        if (namespace != null && !namespace.isBlank()) {
            return this;
        }
        return new SourceReference(kind, name, defaultNamespace);
    }

    @Override
    public String toString() {
        return namespace == null ? kind + "/" + name : kind + "/" + namespace + "/" + name;
    }
}
