package com.platform.reconciler.host;

import java.time.Instant;

/**
 * Result of a service reload.
 *
 * @param wasRunning false when the service was inactive and got started instead of reloaded
 */
public record ReloadResult(
    String service,
    ReloadMethod method,
    boolean wasRunning,
    Instant completedAt
) {
    
    public static ReloadResult reloaded(String service, ReloadMethod method) {
        return new ReloadResult(service, method, true, Instant.now());
    }
    
    public static ReloadResult started(String service) {
        return new ReloadResult(service, ReloadMethod.START, false, Instant.now());
    }
}
