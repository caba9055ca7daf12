package com.platform.reconciler.layer;

import com.platform.reconciler.container.HealthStatus;
import com.platform.reconciler.model.LayerPurpose;
import com.platform.reconciler.model.LayerStrategy;

import java.time.Instant;
import java.util.List;

/**
 * Deployed layer as tracked by the {@link LayerManager}.
 * Base and user layers carry no container and no strategy.
 */
public record LayerInfo(
    String name,
    LayerType type,
    LayerPurpose purpose,
    LayerStrategy strategy,
    LayerStatus status,
    Instant deployedAt,
    List<String> dependencies,
    String containerName,
    HealthStatus health
) {
    
    public LayerInfo {
        dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
        health = health != null ? health : HealthStatus.UNKNOWN;
    }
    
    public LayerInfo withStatus(LayerStatus newStatus) {
        return new LayerInfo(name, type, purpose, strategy, newStatus, deployedAt, dependencies, containerName, health);
    }
    
    public LayerInfo withHealth(HealthStatus newHealth) {
        return new LayerInfo(name, type, purpose, strategy, status, deployedAt, dependencies, containerName, newHealth);
    }
    
    public boolean hasContainer() {
        return type == LayerType.SYSTEM && containerName != null;
    }
}
