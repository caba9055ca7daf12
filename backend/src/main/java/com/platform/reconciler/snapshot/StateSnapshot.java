package com.platform.reconciler.snapshot;

import com.platform.reconciler.host.HostFacts;

import java.time.Instant;

/**
 * Point-in-time copy of the durable state record plus the host facts observed when it was taken.
 *
 * @param hasConfig false when no configuration had been applied yet; restoring then clears the state record
 */
public record StateSnapshot(
    String id,
    Instant createdAt,
    boolean hasConfig,
    HostFacts hostFacts
) {}
