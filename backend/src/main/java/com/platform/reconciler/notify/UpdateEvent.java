package com.platform.reconciler.notify;

import java.time.Instant;
import java.util.Map;

/**
 * Entry in the update history.
 *
 * @param error message of the failure behind the event, null for non-failure events
 */
public record UpdateEvent(
    Instant timestamp,
    UpdateEventType type,
    String message,
    Map<String, String> details,
    String error
) {
    
    public UpdateEvent {
        details = details != null ? Map.copyOf(details) : Map.of();
    }
    
    public static UpdateEvent of(UpdateEventType type, String message, Map<String, String> details) {
        return new UpdateEvent(Instant.now(), type, message, details, null);
    }
    
    public static UpdateEvent failure(UpdateEventType type, String message, Map<String, String> details, Throwable error) {
        return new UpdateEvent(Instant.now(), type, message, details, error != null ? String.valueOf(error.getMessage()) : null);
    }
}
