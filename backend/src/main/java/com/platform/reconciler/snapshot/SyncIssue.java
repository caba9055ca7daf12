package com.platform.reconciler.snapshot;

/**
 * One observed divergence between the host and a configuration.
 */
public record SyncIssue(
    String component,
    String field,
    String expected,
    String actual
) {}
