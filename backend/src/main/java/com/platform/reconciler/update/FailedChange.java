package com.platform.reconciler.update;

import com.platform.reconciler.change.ConfigChange;
import com.platform.reconciler.error.ErrorCode;
import com.platform.reconciler.error.ReconcilerException;

/**
 * A change that could not be applied, with the error that stopped it.
 */
public record FailedChange(
    ConfigChange change,
    String errorCode,
    String error
) {
    
    public static FailedChange of(ConfigChange change, Throwable error) {
        String code = error instanceof ReconcilerException re
            ? re.getErrorCode().getCode()
            : ErrorCode.CHANGE_APPLY_FAILED.getCode();
        return new FailedChange(change, code, String.valueOf(error.getMessage()));
    }
}
