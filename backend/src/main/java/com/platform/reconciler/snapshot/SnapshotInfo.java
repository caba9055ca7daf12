package com.platform.reconciler.snapshot;

import java.time.Instant;

public record SnapshotInfo(
    String id,
    Instant createdAt,
    long sizeBytes,
    boolean hasConfig
) {}
