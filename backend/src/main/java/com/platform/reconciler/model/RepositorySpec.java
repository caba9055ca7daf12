package com.platform.reconciler.model;

import lombok.Builder;

/**
 * A package repository.
 */
@Builder(toBuilder = true)
public record RepositorySpec(
    String name,
    String url,
    Boolean enabled,
    Boolean gpgCheck,
    Integer priority
) {
    
    public RepositorySpec {
        enabled = enabled != null ? enabled : Boolean.TRUE;
        gpgCheck = gpgCheck != null ? gpgCheck : Boolean.TRUE;
        priority = priority != null ? priority : 50;
    }
}
