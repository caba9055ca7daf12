package com.platform.reconciler.model;

import lombok.Builder;

/**
 * Scalar host settings.
 */
@Builder(toBuilder = true)
public record SystemSettings(
    String hostname,
    String timezone,
    String locale
) {
    
    public static SystemSettings defaults() {
        return new SystemSettings("horizonos", "UTC", "en_US.UTF-8");
    }
}
