package com.platform.reconciler.error;

/**
 * Exception for configuration validation errors.
 * Raised before any mutation of the host takes place.
 */
public class ValidationException extends ReconcilerException {
    
    private final String field;
    private final Object rejectedValue;
    
    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
        this.field = null;
        this.rejectedValue = null;
    }
    
    public ValidationException(String field, String message) {
        super(ErrorCode.MISSING_REQUIRED_FIELD, 
            String.format("Invalid value for field '%s': %s", field, message));
        this.field = field;
        this.rejectedValue = null;
    }
    
    public ValidationException(String field, Object rejectedValue, String message) {
        super(ErrorCode.INVALID_FIELD_VALUE, 
            String.format("Invalid value '%s' for field '%s': %s", rejectedValue, field, message));
        this.field = field;
        this.rejectedValue = rejectedValue;
    }
    
    protected ValidationException(ErrorCode errorCode, String field, Object rejectedValue, String message) {
        super(errorCode, message);
        this.field = field;
        this.rejectedValue = rejectedValue;
    }
    
    public String getField() {
        return field;
    }
    
    public Object getRejectedValue() {
        return rejectedValue;
    }
}
