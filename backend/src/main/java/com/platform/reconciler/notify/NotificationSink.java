package com.platform.reconciler.notify;

/**
 * Destination for user-facing update notifications.
 * Implementations may throw; the notifier isolates each sink.
 */
public interface NotificationSink {
    
    String name();
    
    void send(Notification notification);
}
