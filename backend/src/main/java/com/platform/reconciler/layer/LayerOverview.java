package com.platform.reconciler.layer;

import java.util.Map;

/**
 * Counts of tracked layers by status, strategy and type.
 */
public record LayerOverview(
    int total,
    Map<LayerStatus, Long> byStatus,
    Map<String, Long> byStrategy,
    Map<LayerType, Long> byType
) {}
