package com.platform.reconciler.error;

/**
 * Restoring the pre-update snapshot failed. The host is in an unknown state.
 * The update failure that triggered the rollback is attached as suppressed.
 */
public class RollbackFailedException extends ReconcilerException {
    
    private final String snapshotId;
    
    public RollbackFailedException(String snapshotId, Throwable rollbackError, Throwable originalFailure) {
        super(ErrorCode.ROLLBACK_FAILED, 
            String.format("Update failed and rollback to snapshot %s also failed: %s", 
                snapshotId, rollbackError.getMessage()), 
            rollbackError);
        this.snapshotId = snapshotId;
        if (originalFailure != null) {
            addSuppressed(originalFailure);
        }
    }
    
    public String getSnapshotId() {
        return snapshotId;
    }
}
