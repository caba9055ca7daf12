package com.platform.reconciler.model;

import lombok.Builder;

import java.util.List;

@Builder(toBuilder = true)
public record ContainersConfig(
    ContainerRuntime defaultRuntime,
    List<ContainerSpec> containers,
    List<String> globalMounts,
    boolean autoStart,
    boolean cleanupOnExit
) {
    
    public ContainersConfig {
        defaultRuntime = defaultRuntime != null ? defaultRuntime : ContainerRuntime.PODMAN;
        containers = containers != null ? List.copyOf(containers) : List.of();
        globalMounts = globalMounts != null ? List.copyOf(globalMounts) : List.of();
    }
}
