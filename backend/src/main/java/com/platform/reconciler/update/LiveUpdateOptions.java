package com.platform.reconciler.update;

import lombok.Builder;

/**
 * Caller choices for one live update run. Unset values take their defaults.
 *
 * @param allowPartialUpdate apply live and reload changes even when some changes need a reboot
 * @param continueOnError keep applying after a change fails instead of aborting the queue
 * @param rollbackOnFailure restore the pre-update snapshot when the run aborts
 * @param maxParallelOperations upper bound on live changes applied at the same time
 */
@Builder(toBuilder = true)
public record LiveUpdateOptions(
    Boolean dryRun,
    Boolean allowPartialUpdate,
    Boolean continueOnError,
    Boolean rollbackOnFailure,
    Integer maxParallelOperations
) {
    
    public LiveUpdateOptions {
        dryRun = dryRun != null ? dryRun : Boolean.FALSE;
        allowPartialUpdate = allowPartialUpdate != null ? allowPartialUpdate : Boolean.TRUE;
        continueOnError = continueOnError != null ? continueOnError : Boolean.TRUE;
        rollbackOnFailure = rollbackOnFailure != null ? rollbackOnFailure : Boolean.TRUE;
        maxParallelOperations = maxParallelOperations != null && maxParallelOperations > 0 ? maxParallelOperations : 4;
    }
    
    public static LiveUpdateOptions defaults() {
        return LiveUpdateOptions.builder().build();
    }
}
