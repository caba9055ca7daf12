package com.platform.reconciler.host;

import java.util.Map;

/**
 * Host settings observed at a point in time.
 *
 * @param serviceEnablement service name to enabled flag, for the services being tracked
 */
public record HostFacts(
    String hostname,
    String timezone,
    String locale,
    Map<String, Boolean> serviceEnablement
) {
    
    public HostFacts {
        serviceEnablement = serviceEnablement != null ? Map.copyOf(serviceEnablement) : Map.of();
    }
}
