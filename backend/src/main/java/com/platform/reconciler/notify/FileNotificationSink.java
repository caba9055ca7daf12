package com.platform.reconciler.notify;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Appends one line per notification to an update log file.
 */
@Component
@ConditionalOnProperty(name = "reconciler.notify.file.enabled", havingValue = "true")
public class FileNotificationSink implements NotificationSink {
    
    private static final DateTimeFormatter FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneId.systemDefault());
    
    private final Path logFile;
    
    public FileNotificationSink(@Value("${reconciler.notify.file.path:/var/log/horizonos/updates.log}") Path logFile) {
        this.logFile = logFile;
    }
    
    @Override
    public String name() {
        return "file";
    }
    
    @Override
    public synchronized void send(Notification notification) {
        String line = String.format("[%s] %s %s%s: %s%n",
            FORMAT.format(notification.timestamp()),
            notification.level(),
            notification.urgent() ? "(urgent) " : "",
            notification.title(),
            notification.message().replace('\n', ' '));
        try {
            Path parent = logFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(logFile, line, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot append to notification log " + logFile, e);
        }
    }
}
