package com.platform.reconciler.model;

/**
 * Reproducible-build pin recorded alongside deployed state.
 */
public record ReproducibleConfig(
    boolean enabled,
    boolean strictMode,
    boolean verifyDigests,
    String lockfile,
    String pinnedBase
) {
}
