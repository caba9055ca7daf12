package com.platform.reconciler.model;

import lombok.Builder;

import java.util.List;

/**
 * The immutable host image. Described only, never started or stopped.
 */
@Builder(toBuilder = true)
public record BaseLayer(
    String image,
    String tag,
    String digest,
    List<String> packages,
    List<String> services,
    String ostreeRef,
    String ostreeCommit,
    String version
) {
    
    public BaseLayer {
        tag = tag != null ? tag : "latest";
        packages = packages != null ? List.copyOf(packages) : List.of();
        services = services != null ? List.copyOf(services) : List.of();
    }
}
