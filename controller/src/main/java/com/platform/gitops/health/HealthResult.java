package com.platform.gitops.health;

import com.platform.gitops.model.ObjectIdentifier;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of a health assessment.
 *
 * @param notReady tracked objects still not ready, in diagnostic order
 */
public record HealthResult(boolean healthy, List<ObjectIdentifier> notReady, Duration elapsed, String message) {
    
    public HealthResult {
        notReady = List.copyOf(notReady);
    }
}
