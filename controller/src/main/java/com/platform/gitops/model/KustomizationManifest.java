package com.platform.gitops.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Typed form of a Kustomization YAML manifest. Only metadata and spec are read; a status in the
 * manifest is ignored.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class KustomizationManifest {

    public static final String DEFAULT_NAMESPACE = "default";

    private String apiVersion;
    private String kind;

    @NotNull
    @Valid
    private Metadata metadata;

    @NotNull
    @Valid
    private KustomizationSpec spec;

    public UnitKey key() {
        String namespace = metadata.getNamespace();
        return UnitKey.of(namespace == null || namespace.isBlank() ? DEFAULT_NAMESPACE : namespace,
            metadata.getName());
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Metadata {
        @NotBlank
        private String name;
        private String namespace;
    }
}
