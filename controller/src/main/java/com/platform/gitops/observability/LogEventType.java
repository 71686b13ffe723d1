package com.platform.gitops.observability;

/**
 * Event types emitted by {@link StructuredLogger}.
 */
public enum LogEventType {
    
    // Reconciliation
    RECONCILE_STARTED,
    RECONCILE_SUCCEEDED,
    RECONCILE_FAILED,
    RECONCILE_DEFERRED,
    OBJECT_APPLIED,
    OBJECT_PRUNED,
    UNIT_FINALIZED,
    
    // Unit management
    UNIT_CREATED,
    UNIT_UPDATED,
    UNIT_DELETION_REQUESTED,
    
    // Lifecycle
    APP_DRAINING,
    APP_SHUTDOWN,
    
    // Recovery
    RECOVERY_STARTED,
    RECOVERY_COMPLETED
}
