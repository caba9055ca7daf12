package com.platform.reconciler.error;

/**
 * Exception for failures reading or writing durable state and snapshots.
 */
public class StateSyncException extends ReconcilerException {
    
    public StateSyncException(String message) {
        super(ErrorCode.STATE_SYNC_FAILED, message);
    }
    
    public StateSyncException(String message, Throwable cause) {
        super(ErrorCode.STATE_SYNC_FAILED, message, cause);
    }
}
