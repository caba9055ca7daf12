package com.platform.reconciler.model;

import java.util.Map;

/**
 * A systemd service and its declared configuration.
 */
public record ServiceSpec(
    String name,
    boolean enabled,
    Map<String, String> config
) {
    
    public ServiceSpec {
        config = config != null ? Map.copyOf(config) : Map.of();
    }
    
    public static ServiceSpec enabled(String name) {
        return new ServiceSpec(name, true, Map.of());
    }
    
    public static ServiceSpec disabled(String name) {
        return new ServiceSpec(name, false, Map.of());
    }
}
