package com.platform.reconciler.container;

import com.platform.reconciler.model.ContainerRuntime;

import java.time.Instant;
import java.util.List;

/**
 * Registry entry for a created container. The runtime id is cached metadata, the name is the identity.
 */
public record ContainerInfo(
    String id,
    String name,
    String image,
    ContainerRuntime runtime,
    ContainerStatus status,
    Instant createdAt,
    List<String> ports,
    List<String> mounts,
    List<String> exportedBinaries
) {
    
    public ContainerInfo {
        ports = ports != null ? List.copyOf(ports) : List.of();
        mounts = mounts != null ? List.copyOf(mounts) : List.of();
        exportedBinaries = exportedBinaries != null ? List.copyOf(exportedBinaries) : List.of();
    }
    
    public ContainerInfo withStatus(ContainerStatus newStatus) {
        return new ContainerInfo(id, name, image, runtime, newStatus, createdAt, ports, mounts, exportedBinaries);
    }
    
    public ContainerInfo withId(String newId) {
        return new ContainerInfo(newId, name, image, runtime, status, createdAt, ports, mounts, exportedBinaries);
    }
    
    public ContainerInfo withExportedBinaries(List<String> binaries) {
        return new ContainerInfo(id, name, image, runtime, status, createdAt, ports, mounts, binaries);
    }
}
