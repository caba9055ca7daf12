package com.platform.reconciler.model;

import lombok.Builder;

import java.util.List;

@Builder(toBuilder = true)
public record LayersConfig(
    BaseLayer base,
    List<SystemLayer> system,
    UserLayer user,
    List<String> globalMounts,
    List<String> sharedVolumes
) {
    
    public LayersConfig {
        system = system != null ? List.copyOf(system) : List.of();
        globalMounts = globalMounts != null ? List.copyOf(globalMounts) : List.of();
        sharedVolumes = sharedVolumes != null ? List.copyOf(sharedVolumes) : List.of();
    }
}
