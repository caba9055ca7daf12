package com.platform.reconciler.error;

/**
 * A single change could not be applied.
 */
public class ChangeApplyException extends ReconcilerException {
    
    public ChangeApplyException(String message) {
        super(ErrorCode.CHANGE_APPLY_FAILED, message);
    }
    
    public ChangeApplyException(String message, Throwable cause) {
        super(ErrorCode.CHANGE_APPLY_FAILED, message, cause);
    }
}
