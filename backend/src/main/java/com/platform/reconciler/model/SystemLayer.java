package com.platform.reconciler.model;

import lombok.Builder;

import java.util.List;

/**
 * A named layer wrapping exactly one container plus its activation policy.
 * Lower {@code priority} starts first among layers that are ready at the same time.
 */
@Builder(toBuilder = true)
public record SystemLayer(
    String name,
    LayerPurpose purpose,
    ContainerSpec container,
    List<String> dependencies,
    LayerStrategy strategy,
    Integer priority,
    Boolean enabled,
    Boolean autoStart,
    HealthCheckSpec healthCheck
) {
    
    public SystemLayer {
        purpose = purpose != null ? purpose : LayerPurpose.CUSTOM;
        dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
        strategy = strategy != null ? strategy : LayerStrategy.ON_DEMAND;
        priority = priority != null ? priority : 50;
        enabled = enabled != null ? enabled : Boolean.TRUE;
        autoStart = autoStart != null ? autoStart : Boolean.FALSE;
    }
}
