package com.platform.reconciler.notify;

import java.time.Instant;

public record Notification(
    NotificationLevel level,
    String title,
    String message,
    boolean urgent,
    Instant timestamp
) {
    
    public static Notification of(NotificationLevel level, String title, String message, boolean urgent) {
        return new Notification(level, title, message, urgent, Instant.now());
    }
}
