package com.platform.reconciler.change;

import java.util.List;

/**
 * Changes partitioned by update strategy, detection order preserved within each bucket.
 */
public record CategorizedChanges(
    List<ConfigChange> live,
    List<ConfigChange> serviceReload,
    List<ConfigChange> rebootRequired
) {
    
    public CategorizedChanges {
        live = List.copyOf(live);
        serviceReload = List.copyOf(serviceReload);
        rebootRequired = List.copyOf(rebootRequired);
    }
    
    public boolean isEmpty() {
        return live.isEmpty() && serviceReload.isEmpty() && rebootRequired.isEmpty();
    }
    
    public boolean requiresReboot() {
        return !rebootRequired.isEmpty();
    }
    
    public int applicableCount() {
        return live.size() + serviceReload.size();
    }
}
