package com.platform.reconciler.model;

/**
 * Activation policy of a system layer.
 */
public enum LayerStrategy {
    /** Started right after deployment. */
    ALWAYS_ON,
    /** Deployed but left stopped until explicitly started. */
    ON_DEMAND,
    /** Recreated on every start and removed on every stop. */
    EPHEMERAL
}
