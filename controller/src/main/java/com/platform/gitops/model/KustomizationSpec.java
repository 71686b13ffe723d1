package com.platform.gitops.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * User owned desired state of a Kustomization. Read-only to the engine.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class KustomizationSpec {

    /**
     * Units that must be ready before this one is built.
     */
    @Valid
    @Builder.Default
    private List<DependencyReference> dependsOn = new ArrayList<>();

    @Valid
    private Decryption decryption;

    /**
     * Reconcile period.
     */
    @NotNull
    @JsonSerialize(using = DurationFormat.Serializer.class)
    @JsonDeserialize(using = DurationFormat.Deserializer.class)
    private Duration interval;

    /**
     * Period used after a failed attempt. Falls back to {@link #interval}.
     */
    @JsonSerialize(using = DurationFormat.Serializer.class)
    @JsonDeserialize(using = DurationFormat.Deserializer.class)
    private Duration retryInterval;

    /**
     * Remote cluster access. Takes precedence over {@link #serviceAccountName}.
     */
    @Valid
    private KubeConfigReference kubeConfig;

    /**
     * Build path inside the source artifact. Defaults to the artifact root.
     */
    private String path;

    @Valid
    private PostBuild postBuild;

    /**
     * Garbage collect objects that disappeared from the render.
     */
    private boolean prune;

    @Valid
    @Builder.Default
    private List<HealthCheckReference> healthChecks = new ArrayList<>();

    @Valid
    @Builder.Default
    private List<Patch> patches = new ArrayList<>();

    @Valid
    @Builder.Default
    private List<Image> images = new ArrayList<>();

    private String serviceAccountName;

    @NotNull
    @Valid
    private SourceReference sourceRef;

    /**
     * Parks the reconcile loop. Running attempts are not affected.
     */
    private boolean suspend;

    @Size(min = 1, max = 63)
    private String targetNamespace;

    /**
     * Budget shared by build, apply and health assessment.
     */
    @JsonSerialize(using = DurationFormat.Serializer.class)
    @JsonDeserialize(using = DurationFormat.Deserializer.class)
    private Duration timeout;

    /**
     * Recreate objects whose update fails on an immutable field.
     */
    private boolean force;

    /**
     * Assess the health of every applied object. Supersedes {@link #healthChecks}.
     */
    private boolean wait;

    public List<DependencyReference> getDependsOn() {
        return dependsOn == null ? List.of() : dependsOn;
    }

    public List<HealthCheckReference> getHealthChecks() {
        return healthChecks == null ? List.of() : healthChecks;
    }

    public List<Patch> getPatches() {
        return patches == null ? List.of() : patches;
    }

    public List<Image> getImages() {
        return images == null ? List.of() : images;
    }
}
