package com.platform.gitops.error;

/**
 * A request the API refuses before anything is stored.
 * {@link #getField()} names the offending spec or manifest field when one is to blame.
 */
public class ValidationException extends ControllerException {
    
    private final String field;
    
    public ValidationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
        this.field = null;
    }
    
    public ValidationException(String field, String problem) {
        super(ErrorCode.INVALID_FIELD_VALUE, field + ": " + problem);
        this.field = field;
    }
    
    public String getField() {
        return field;
    }
}
