package com.platform.reconciler.model;

import lombok.Builder;

/**
 * Health probe run inside a layer's container.
 */
@Builder(toBuilder = true)
public record HealthCheckSpec(
    String command,
    String interval,
    String timeout,
    Integer retries,
    String startPeriod
) {
    
    public HealthCheckSpec {
        interval = interval != null ? interval : "30s";
        timeout = timeout != null ? timeout : "10s";
        retries = retries != null ? retries : 3;
        startPeriod = startPeriod != null ? startPeriod : "60s";
    }
}
