package com.platform.reconciler.update;

import java.time.Duration;

/**
 * Preview of what a live update between two configurations would do.
 */
public record LiveUpdateCapability(
    boolean canFullyUpdate,
    int liveUpdatableChanges,
    int rebootRequiredChanges,
    Duration estimatedDuration
) {}
