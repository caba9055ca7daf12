package com.platform.reconciler.notify;

import com.platform.reconciler.change.ConfigChange;
import com.platform.reconciler.change.ImpactLevel;
import com.platform.reconciler.model.SystemConfiguration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Records update lifecycle events and fans user-facing notifications out to every sink.
 * A failing sink is logged and skipped; it never fails the update.
 */
@Slf4j
@Component
public class UpdateNotifier {
    
    private final List<NotificationSink> sinks;
    private final int historySize;
    private final Deque<UpdateEvent> history = new ArrayDeque<>();
    
    public UpdateNotifier(
            List<NotificationSink> sinks,
            @Value("${reconciler.update.history-size:1000}") int historySize) {
        this.sinks = List.copyOf(sinks);
        this.historySize = historySize;
        log.info("Update notifier initialized with sinks {}", this.sinks.stream().map(NotificationSink::name).toList());
    }
    
    // ==================== Lifecycle Events ====================
    
    public void updateStarted(SystemConfiguration desired) {
        record(UpdateEvent.of(UpdateEventType.UPDATE_STARTED,
            "Starting live update for configuration: " + desired.system().hostname(),
            Map.of(
                "hostname", String.valueOf(desired.system().hostname()),
                "packages", String.valueOf(desired.packages().size()),
                "services", String.valueOf(desired.services().size()))));
        
        broadcast(NotificationLevel.INFO, "System Update Starting", "Applying configuration updates", false);
    }
    
    public void noChanges() {
        record(UpdateEvent.of(UpdateEventType.NO_CHANGES, "No configuration changes detected", Map.of()));
        broadcast(NotificationLevel.INFO, "No Updates Required", "System configuration is already up to date", false);
    }
    
    public void rebootRequired(List<ConfigChange> changes) {
        record(UpdateEvent.of(UpdateEventType.REBOOT_REQUIRED,
            "Reboot required for " + changes.size() + " changes",
            Map.of("changes", changes.stream().map(ConfigChange::description).collect(Collectors.joining(", ")))));
        
        String list = changes.stream().map(c -> "• " + c.description()).collect(Collectors.joining("\n"));
        broadcast(NotificationLevel.WARNING, "Reboot Required",
            "Some changes require a system reboot:\n" + list, true);
    }
    
    /**
     * Low-impact changes are recorded but not broadcast.
     */
    public void changeApplied(ConfigChange change) {
        record(UpdateEvent.of(UpdateEventType.CHANGE_APPLIED, "Applied: " + change.description(),
            Map.of("changeType", change.type().name(), "impact", String.valueOf(change.impactLevel()))));
        
        if (change.impactLevel() != null && change.impactLevel().isAtLeast(ImpactLevel.MEDIUM)) {
            broadcast(NotificationLevel.INFO, "Configuration Updated", change.description(), false);
        }
    }
    
    public void changeFailed(ConfigChange change, Throwable error) {
        record(UpdateEvent.failure(UpdateEventType.CHANGE_FAILED, "Failed: " + change.description(),
            Map.of("changeType", change.type().name(), "error", String.valueOf(error.getMessage())), error));
        
        broadcast(NotificationLevel.ERROR, "Update Failed",
            "Failed to apply: " + change.description() + "\nError: " + error.getMessage(), true);
    }
    
    public void updateCompleted(int applied, int failed, int pendingReboot) {
        record(UpdateEvent.of(UpdateEventType.UPDATE_COMPLETED,
            String.format("Update completed: %d applied, %d failed", applied, failed),
            Map.of(
                "applied", String.valueOf(applied),
                "failed", String.valueOf(failed),
                "pendingReboot", String.valueOf(pendingReboot))));
        
        StringBuilder message = new StringBuilder("Configuration update completed:\n")
            .append(applied).append(" changes applied successfully");
        if (failed > 0) {
            message.append("\n").append(failed).append(" changes failed");
        }
        if (pendingReboot > 0) {
            message.append("\n").append(pendingReboot).append(" changes pending reboot");
        }
        broadcast(failed == 0 ? NotificationLevel.SUCCESS : NotificationLevel.WARNING,
            "Update Completed", message.toString(), false);
    }
    
    public void updateFailed(Throwable error) {
        record(UpdateEvent.failure(UpdateEventType.UPDATE_FAILED, "Update failed: " + error.getMessage(), Map.of(), error));
        broadcast(NotificationLevel.ERROR, "Update Failed", "System update failed: " + error.getMessage(), true);
    }
    
    public void rollbackStarted() {
        record(UpdateEvent.of(UpdateEventType.ROLLBACK_STARTED, "Starting rollback due to update failure", Map.of()));
        broadcast(NotificationLevel.WARNING, "Rolling Back Changes", "Reverting system to previous state", false);
    }
    
    public void rollbackCompleted() {
        record(UpdateEvent.of(UpdateEventType.ROLLBACK_COMPLETED, "Rollback completed successfully", Map.of()));
        broadcast(NotificationLevel.INFO, "Rollback Completed", "System has been restored to previous state", false);
    }
    
    public void rollbackFailed(Throwable error) {
        record(UpdateEvent.failure(UpdateEventType.ROLLBACK_FAILED, "Rollback failed: " + error.getMessage(), Map.of(), error));
        broadcast(NotificationLevel.CRITICAL, "Rollback Failed",
            "Failed to restore system state: " + error.getMessage(), true);
    }
    
    // ==================== History ====================
    
    /**
     * Most recent events, oldest first.
     */
    public List<UpdateEvent> history(int limit) {
        synchronized (history) {
            List<UpdateEvent> all = new ArrayList<>(history);
            return List.copyOf(all.subList(Math.max(0, all.size() - limit), all.size()));
        }
    }
    
    private void record(UpdateEvent event) {
        synchronized (history) {
            history.addLast(event);
            while (history.size() > historySize) {
                history.removeFirst();
            }
        }
        log.debug("Update event {}: {}", event.type(), event.message());
    }
    
    private void broadcast(NotificationLevel level, String title, String message, boolean urgent) {
        Notification notification = Notification.of(level, title, message, urgent);
        for (NotificationSink sink : sinks) {
            try {
                sink.send(notification);
            } catch (RuntimeException e) {
                log.warn("Notification sink {} failed: {}", sink.name(), e.getMessage());
            }
        }
    }
}
