package com.platform.reconciler.notify;

import com.platform.reconciler.host.CommandRunner;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Sends notifications to the systemd journal through {@code systemd-cat}.
 */
@Component
@ConditionalOnProperty(name = "reconciler.notify.journal.enabled", havingValue = "true")
public class JournalNotificationSink implements NotificationSink {
    
    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    
    private final CommandRunner commandRunner;
    private final String tag;
    
    public JournalNotificationSink(
            CommandRunner commandRunner,
            @Value("${reconciler.notify.journal.tag:horizonos-update}") String tag) {
        this.commandRunner = commandRunner;
        this.tag = tag;
    }
    
    @Override
    public String name() {
        return "journal";
    }
    
    @Override
    public void send(Notification notification) {
        commandRunner.runChecked(List.of(
            "systemd-cat", "-t", tag, "-p", String.valueOf(notification.level().journalPriority()),
            "echo", notification.title() + ": " + notification.message()), TIMEOUT);
    }
}
