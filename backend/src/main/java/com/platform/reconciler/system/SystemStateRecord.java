package com.platform.reconciler.system;

import com.platform.reconciler.container.ContainerInfo;
import com.platform.reconciler.container.HealthStatus;
import com.platform.reconciler.layer.LayerInfo;
import com.platform.reconciler.model.ReproducibleConfig;

import java.time.Instant;
import java.util.List;

/**
 * Persisted description of what is deployed on this host.
 */
public record SystemStateRecord(
    String version,
    Instant timestamp,
    List<ContainerInfo> containers,
    List<LayerInfo> layers,
    ReproducibleConfig reproducible,
    HealthStatus systemHealth
) {

    public static final String CURRENT_VERSION = "1.0.0";

    public SystemStateRecord {
        containers = containers != null ? List.copyOf(containers) : List.of();
        layers = layers != null ? List.copyOf(layers) : List.of();
    }
}
