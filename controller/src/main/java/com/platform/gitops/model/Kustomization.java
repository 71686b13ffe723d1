package com.platform.gitops.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * The reconciled unit: identity, generation, user spec and controller status.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Kustomization {

    public static final String GROUP = "kustomize.toolkit.fluxcd.io";
    public static final String KIND = "Kustomization";
    public static final int MAX_CONDITION_MESSAGE_LENGTH = 20000;

    private static final Duration TIMEOUT_OFFSET = Duration.ofSeconds(30);
    private static final Duration MIN_TIMEOUT = Duration.ofSeconds(30);

    private String namespace;
    private String name;

    /**
     * Bumped on every spec change.
     */
    @Builder.Default
    private long generation = 1L;

    /**
     * Set when deletion was requested; the unit is removed after its finalizing prune pass.
     */
    private Instant deletionTimestamp;

    /**
     * Time of the latest manual reconcile request, if any.
     */
    private Instant reconcileRequestedAt;

    private KustomizationSpec spec;

    @Builder.Default
    private KustomizationStatus status = KustomizationStatus.initial();

    @JsonIgnore
    public UnitKey getKey() {
        return UnitKey.of(namespace, name);
    }

    /**
     * Budget for one attempt: the explicit timeout, or the interval minus 30s, never below 30s.
     */
    @JsonIgnore
    public Duration getTimeout() {
        Duration duration = spec.getTimeout() != null
            ? spec.getTimeout()
            : spec.getInterval().minus(TIMEOUT_OFFSET);
        return duration.compareTo(MIN_TIMEOUT) < 0 ? MIN_TIMEOUT : duration;
    }

    /**
     * Delay before the next attempt after a failure.
     */
    @JsonIgnore
    public Duration getRetryInterval() {
        return spec.getRetryInterval() != null ? spec.getRetryInterval() : spec.getInterval();
    }

    /**
     * Dependencies with their namespace defaulted to this unit's namespace, in declaration order.
     */
    @JsonIgnore
    public List<UnitKey> getDependencyKeys() {
        return spec.getDependsOn().stream().map(d -> d.resolve(namespace)).toList();
    }

    /**
     * Whether a Healthy condition is tracked for this unit.
     */
    @JsonIgnore
    public boolean isHealthCheckRequired() {
        return spec.isWait() || !spec.getHealthChecks().isEmpty();
    }

    @JsonIgnore
    public boolean isBeingDeleted() {
        return deletionTimestamp != null;
    }

    @JsonIgnore
    public SourceReference getResolvedSourceRef() {
        return spec.getSourceRef().withDefaultNamespace(namespace);
    }

    public KustomizationStatus getStatus() {
        if (status == null) {
            status = KustomizationStatus.initial();
        }
        return status;
    }
}
