package com.platform.reconciler.notify;

import com.platform.reconciler.observability.StructuredLogger;
import org.springframework.stereotype.Component;

/**
 * Writes notifications as structured JSON log lines.
 */
@Component
public class LogNotificationSink implements NotificationSink {
    
    private final StructuredLogger structuredLogger;
    
    public LogNotificationSink(StructuredLogger structuredLogger) {
        this.structuredLogger = structuredLogger;
    }
    
    @Override
    public String name() {
        return "log";
    }
    
    @Override
    public void send(Notification notification) {
        String level = switch (notification.level()) {
            case DEBUG -> "DEBUG";
            case INFO, SUCCESS -> "INFO";
            case WARNING -> "WARN";
            case ERROR, CRITICAL -> "ERROR";
        };
        structuredLogger.update().notification(level, notification.title(), notification.message(), notification.urgent());
    }
}
