package com.platform.reconciler.model;

import lombok.Builder;

import java.util.List;

/**
 * Immutable, fully-resolved system configuration.
 * Two of these (current and desired) are the sole inputs to reconciliation.
 * Optional sub-configurations are {@code null} when absent.
 */
@Builder(toBuilder = true)
public record SystemConfiguration(
    SystemSettings system,
    List<PackageSpec> packages,
    List<ServiceSpec> services,
    List<UserSpec> users,
    List<RepositorySpec> repositories,
    DesktopConfig desktop,
    AutomationConfig automation,
    ContainersConfig containers,
    LayersConfig layers,
    ReproducibleConfig reproducible
) {
    
    public SystemConfiguration {
        system = system != null ? system : SystemSettings.defaults();
        packages = packages != null ? List.copyOf(packages) : List.of();
        services = services != null ? List.copyOf(services) : List.of();
        users = users != null ? List.copyOf(users) : List.of();
        repositories = repositories != null ? List.copyOf(repositories) : List.of();
    }
    
    /**
     * Configuration with default system settings and nothing else.
     * Used as "current state" before anything has been applied.
     */
    public static SystemConfiguration empty() {
        return SystemConfiguration.builder().build();
    }
    
    public List<ContainerSpec> declaredContainers() {
        return containers != null ? containers.containers() : List.of();
    }
    
    public List<SystemLayer> declaredLayers() {
        return layers != null ? layers.system() : List.of();
    }
}
