package com.platform.reconciler.update;

import java.time.Instant;

/**
 * What the most recent run did, for status queries.
 */
public record UpdateRunSummary(
    String updateId,
    Instant startedAt,
    Instant finishedAt,
    UpdatePhase finalPhase,
    String outcome,
    boolean dryRun,
    String snapshotId
) {}
