package com.platform.gitops.model;

import java.time.Instant;

/**
 * A single status condition. Immutable; replaced through {@link Conditions#upsert}.
 */
public record Condition(
    String type,
    ConditionStatus status,
    String reason,
    String message,
    long observedGeneration,
    Instant lastTransitionTime
) {

    public boolean isTrue() {
        return status == ConditionStatus.TRUE;
    }
}
