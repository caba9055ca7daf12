package com.platform.reconciler.model;

import lombok.Builder;

import java.util.List;
import java.util.Map;

/**
 * Declared container. Identity is {@link #name()}.
 */
@Builder(toBuilder = true)
public record ContainerSpec(
    String name,
    String image,
    String tag,
    String digest,
    ContainerRuntime runtime,
    List<String> packages,
    List<String> preCommands,
    List<String> postCommands,
    Boolean autoStart,
    List<String> binaries,
    List<String> persistent,
    Map<String, String> environment,
    List<String> ports,
    Boolean privileged,
    String networkMode,
    String hostname,
    String user,
    String workingDir,
    Map<String, String> labels
) {
    
    public ContainerSpec {
        tag = tag != null ? tag : "latest";
        packages = packages != null ? List.copyOf(packages) : List.of();
        preCommands = preCommands != null ? List.copyOf(preCommands) : List.of();
        postCommands = postCommands != null ? List.copyOf(postCommands) : List.of();
        autoStart = autoStart != null ? autoStart : Boolean.FALSE;
        binaries = binaries != null ? List.copyOf(binaries) : List.of();
        persistent = persistent != null ? List.copyOf(persistent) : List.of();
        environment = environment != null ? Map.copyOf(environment) : Map.of();
        ports = ports != null ? List.copyOf(ports) : List.of();
        privileged = privileged != null ? privileged : Boolean.FALSE;
        networkMode = networkMode != null ? networkMode : "bridge";
        labels = labels != null ? Map.copyOf(labels) : Map.of();
    }
    
    /**
     * Fully-qualified image reference. A pinned digest takes precedence over the tag.
     */
    public String imageReference() {
        if (digest != null && !digest.isBlank()) {
            return image + "@" + digest;
        }
        return image + ":" + tag;
    }
    
    public ContainerRuntime runtimeOr(ContainerRuntime fallback) {
        return runtime != null ? runtime : fallback;
    }
}
