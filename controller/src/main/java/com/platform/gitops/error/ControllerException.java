package com.platform.gitops.error;

/**
 * Base exception for all controller exceptions.
 * Carries an ErrorCode for standardized error handling.
 */
public abstract class ControllerException extends RuntimeException {
    
    private final ErrorCode errorCode;
    
    protected ControllerException(ErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }
    
    protected ControllerException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    protected ControllerException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public ErrorCode getErrorCode() {
        return errorCode;
    }
    
    public boolean isFatal() {
        return errorCode.isFatal();
    }
}
