package com.platform.reconciler.snapshot;

import java.util.List;

/**
 * Result of comparing the host against a configuration. In sync exactly when there are no issues.
 */
public record SyncStatus(List<SyncIssue> issues) {
    
    public SyncStatus {
        issues = List.copyOf(issues);
    }
    
    public static SyncStatus inSync() {
        return new SyncStatus(List.of());
    }
    
    public static SyncStatus outOfSync(List<SyncIssue> issues) {
        return new SyncStatus(issues);
    }
    
    public boolean isInSync() {
        return issues.isEmpty();
    }
}
