package com.platform.gitops.model;

/**
 * Stable condition type and reason strings consumed by tooling.
 */
public final class ConditionReasons {

    // Condition types
    public static final String READY = "Ready";
    public static final String HEALTHY = "Healthy";

    // Reasons
    public static final String PROGRESSING = "Progressing";
    public static final String DEPENDENCY_NOT_READY = "DependencyNotReady";
    public static final String DEPENDENCY_CYCLE_DETECTED = "DependencyCycleDetected";
    public static final String ARTIFACT_FAILED = "ArtifactFailed";
    public static final String BUILD_FAILED = "BuildFailed";
    public static final String DECRYPTION_FAILED = "DecryptionFailed";
    public static final String SUBSTITUTION_FAILED = "SubstitutionFailed";
    public static final String APPLY_FAILED = "ApplyFailed";
    public static final String PRUNE_FAILED = "PruneFailed";
    public static final String UNHEALTHY = "Unhealthy";
    public static final String RECONCILIATION_SUCCEEDED = "ReconciliationSucceeded";

    private ConditionReasons() {
    }
}
