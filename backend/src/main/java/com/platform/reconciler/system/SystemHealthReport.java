package com.platform.reconciler.system;

import com.platform.reconciler.container.HealthStatus;

import java.time.Instant;
import java.util.Map;

/**
 * Aggregated health of containers, layers and expected host services.
 */
public record SystemHealthReport(
    HealthStatus overall,
    Map<String, HealthStatus> containers,
    Map<String, HealthStatus> layers,
    Map<String, HealthStatus> services,
    Instant lastCheck
) {

    public static SystemHealthReport unknown() {
        return new SystemHealthReport(HealthStatus.UNKNOWN, Map.of(), Map.of(), Map.of(), null);
    }
}
