package com.platform.reconciler.model;

import lombok.Builder;

import java.util.List;

/**
 * An automation workflow definition, keyed by name.
 */
@Builder(toBuilder = true)
public record WorkflowSpec(
    String name,
    String description,
    Boolean enabled,
    Integer priority,
    String trigger,
    List<String> actions
) {
    
    public WorkflowSpec {
        enabled = enabled != null ? enabled : Boolean.TRUE;
        priority = priority != null ? priority : 50;
        actions = actions != null ? List.copyOf(actions) : List.of();
    }
}
