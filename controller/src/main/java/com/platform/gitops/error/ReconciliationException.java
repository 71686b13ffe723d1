package com.platform.gitops.error;

/**
 * Failure of one phase of a reconciliation attempt.
 * The error code decides the Ready condition reason and the requeue cadence.
 */
public class ReconciliationException extends ControllerException {
    
    public ReconciliationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
    
    public ReconciliationException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
