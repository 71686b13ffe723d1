package com.platform.gitops.error;

import com.platform.gitops.model.ConditionReasons;

/**
 * Standardized error codes for the controller.
 * Reconciliation codes also carry the condition reason they surface as and the cadence at which
 * the failed unit is retried.
 * 
 * Format: GO-{CATEGORY}{NUMBER}
 * Categories:
 * - 1xx: Validation errors
 * - 3xx: Resource errors (not found, conflict)
 * - 6xx: Reconciliation errors
 * - 9xx: Internal errors (unexpected)
 */
public enum ErrorCode {
    
    // ==================== Validation Errors (1xx) ====================
    
    VALIDATION_ERROR("GO-100", "Validation error", null, ErrorCategory.RECOVERABLE),
    INVALID_REQUEST("GO-101", "Invalid request format", null, ErrorCategory.RECOVERABLE),
    INVALID_FIELD_VALUE("GO-103", "Invalid field value", null, ErrorCategory.RECOVERABLE),
    INVALID_MANIFEST("GO-104", "Invalid Kustomization manifest", null, ErrorCategory.RECOVERABLE),
    
    // ==================== Resource Errors (3xx) ====================
    
    RESOURCE_NOT_FOUND("GO-300", "Resource not found", null, ErrorCategory.RECOVERABLE),
    KUSTOMIZATION_NOT_FOUND("GO-301", "Kustomization not found", null, ErrorCategory.RECOVERABLE),
    RESOURCE_CONFLICT("GO-310", "Resource conflict", null, ErrorCategory.RECOVERABLE),
    OPTIMISTIC_LOCK_FAILURE("GO-312", "Concurrent modification", null, ErrorCategory.RECOVERABLE),
    
    // ==================== Reconciliation Errors (6xx) ====================
    
    DEPENDENCY_NOT_READY("GO-600", "Dependency not ready",
        ConditionReasons.DEPENDENCY_NOT_READY, ErrorCategory.RECOVERABLE, RequeuePolicy.DEPENDENCY_BACKOFF),
    DEPENDENCY_CYCLE("GO-601", "Dependency cycle detected",
        ConditionReasons.DEPENDENCY_CYCLE_DETECTED, ErrorCategory.CONFIGURATION, RequeuePolicy.RETRY_INTERVAL),
    ARTIFACT_FAILED("GO-610", "Source artifact unavailable",
        ConditionReasons.ARTIFACT_FAILED, ErrorCategory.RECOVERABLE, RequeuePolicy.RETRY_INTERVAL),
    BUILD_FAILED("GO-620", "Overlay build failed",
        ConditionReasons.BUILD_FAILED, ErrorCategory.RECOVERABLE, RequeuePolicy.RETRY_INTERVAL),
    DECRYPTION_FAILED("GO-621", "Decryption failed",
        ConditionReasons.DECRYPTION_FAILED, ErrorCategory.RECOVERABLE, RequeuePolicy.RETRY_INTERVAL),
    SUBSTITUTION_FAILED("GO-622", "Variable substitution failed",
        ConditionReasons.SUBSTITUTION_FAILED, ErrorCategory.RECOVERABLE, RequeuePolicy.RETRY_INTERVAL),
    APPLY_FAILED("GO-630", "Apply failed",
        ConditionReasons.APPLY_FAILED, ErrorCategory.RECOVERABLE, RequeuePolicy.RETRY_INTERVAL),
    PRUNE_FAILED("GO-631", "Prune failed",
        ConditionReasons.PRUNE_FAILED, ErrorCategory.RECOVERABLE, RequeuePolicy.RETRY_INTERVAL),
    UNHEALTHY("GO-640", "Health check failed",
        ConditionReasons.UNHEALTHY, ErrorCategory.RECOVERABLE, RequeuePolicy.RETRY_INTERVAL),
    
    // ==================== Internal Errors (9xx) ====================
    
    INTERNAL_ERROR("GO-900", "Internal server error", null, ErrorCategory.FATAL);
    
    private final String code;
    private final String defaultMessage;
    private final String conditionReason;
    private final ErrorCategory category;
    private final RequeuePolicy requeuePolicy;
    
    ErrorCode(String code, String defaultMessage, String conditionReason, ErrorCategory category) {
        this(code, defaultMessage, conditionReason, category, RequeuePolicy.RETRY_INTERVAL);
    }
    
    ErrorCode(String code, String defaultMessage, String conditionReason, ErrorCategory category,
              RequeuePolicy requeuePolicy) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.conditionReason = conditionReason;
        this.category = category;
        this.requeuePolicy = requeuePolicy;
    }
    
    public String getCode() {
        return code;
    }
    
    public String getDefaultMessage() {
        return defaultMessage;
    }
    
    /**
     * Reason written to the Ready condition, or {@code null} for API-only codes.
     */
    public String getConditionReason() {
        return conditionReason;
    }
    
    public ErrorCategory getCategory() {
        return category;
    }
    
    public RequeuePolicy getRequeuePolicy() {
        return requeuePolicy;
    }
    
    public boolean isFatal() {
        return category == ErrorCategory.FATAL;
    }
    
    /**
     * Error category for distinguishing fatal, recoverable and misconfiguration errors.
     */
    public enum ErrorCategory {
        /**
         * Transient; retrying may succeed without user action.
         */
        RECOVERABLE,
        
        /**
         * The user configuration is wrong; retrying at a faster pace cannot help.
         */
        CONFIGURATION,
        
        /**
         * The controller is in a bad state and may require intervention.
         */
        FATAL
    }
    
    /**
     * When a unit that failed with this code is attempted again.
     */
    public enum RequeuePolicy {
        /**
         * Short fixed backoff, independent from the unit's retry interval.
         */
        DEPENDENCY_BACKOFF,
        
        /**
         * The unit's retry interval.
         */
        RETRY_INTERVAL
    }
}
