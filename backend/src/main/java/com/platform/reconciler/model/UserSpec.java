package com.platform.reconciler.model;

import lombok.Builder;

import java.util.List;

/**
 * A local user account.
 */
@Builder(toBuilder = true)
public record UserSpec(
    String name,
    Integer uid,
    String shell,
    List<String> groups,
    String homeDir
) {
    
    public UserSpec {
        shell = shell != null ? shell : "/bin/bash";
        groups = groups != null ? List.copyOf(groups) : List.of();
    }
}
