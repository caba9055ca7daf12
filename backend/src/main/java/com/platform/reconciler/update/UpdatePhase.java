package com.platform.reconciler.update;

/**
 * Phase of a live update run.
 */
public enum UpdatePhase {
    IDLE,
    DETECTING,
    CLASSIFYING,
    /** Changes need a reboot and partial updates were not allowed; nothing was touched. */
    REBOOT_BLOCKED,
    APPLYING,
    COMMITTED,
    ROLLED_BACK,
    FAILED;
    
    public boolean isTerminal() {
        return this == REBOOT_BLOCKED || this == COMMITTED || this == ROLLED_BACK || this == FAILED;
    }
}
