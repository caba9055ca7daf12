package com.platform.reconciler.model;

import java.util.List;

public record AutomationConfig(
    boolean enabled,
    List<WorkflowSpec> workflows
) {
    
    public AutomationConfig {
        workflows = workflows != null ? List.copyOf(workflows) : List.of();
    }
}
