package com.platform.gitops.status;

import com.platform.gitops.model.ConditionStatus;

import java.time.Instant;

/**
 * A recorded change of one condition of one unit.
 * {@code from} is {@code null} when the condition did not exist before.
 */
public record ConditionTransition(
    String unit,
    String type,
    ConditionStatus from,
    ConditionStatus to,
    String reason,
    String message,
    long observedGeneration,
    Instant at
) {
}
