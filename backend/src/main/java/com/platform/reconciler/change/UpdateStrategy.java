package com.platform.reconciler.change;

/**
 * Mechanism needed to apply a change. Declared from least to most disruptive.
 */
public enum UpdateStrategy {
    /** Applied immediately on the running system. */
    LIVE,
    /** Requires a service reload or restart. */
    SERVICE_RELOAD,
    /** Unsafe without a full restart; never applied live. */
    REBOOT_REQUIRED;
    
    public UpdateStrategy stricter(UpdateStrategy other) {
        return other != null && other.ordinal() > ordinal() ? other : this;
    }
}
