package com.platform.reconciler.error;

/**
 * A live update run was aborted.
 */
public class LiveUpdateException extends ReconcilerException {
    
    public LiveUpdateException(String message) {
        super(ErrorCode.LIVE_UPDATE_FAILED, message);
    }
    
    public LiveUpdateException(String message, Throwable cause) {
        super(ErrorCode.LIVE_UPDATE_FAILED, message, cause);
    }
    
    public LiveUpdateException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
