package com.platform.reconciler.lifecycle;

import com.platform.reconciler.observability.MetricsRegistry;
import com.platform.reconciler.observability.StructuredLogger;
import com.platform.reconciler.update.LiveUpdateManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Graceful shutdown.
 * 
 * Order:
 * 1. Refuse new work
 * 2. Stop the health-check scheduler
 * 3. Wait for a running live update to finish (it owns a snapshot and may need to roll back)
 */
@Slf4j
@Component
public class GracefulShutdownManager implements ApplicationListener<ContextClosedEvent> {
    
    private static final long POLL_INTERVAL_MS = 200;
    
    private final ApplicationLifecycleManager lifecycleManager;
    private final ThreadPoolTaskScheduler taskScheduler;
    private final LiveUpdateManager liveUpdateManager;
    private final MetricsRegistry metricsRegistry;
    private final StructuredLogger structuredLogger;
    private final Duration updateDrainTimeout;
    
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
    
    public GracefulShutdownManager(
            ApplicationLifecycleManager lifecycleManager,
            ThreadPoolTaskScheduler taskScheduler,
            LiveUpdateManager liveUpdateManager,
            MetricsRegistry metricsRegistry,
            StructuredLogger structuredLogger,
            @Value("${reconciler.shutdown.update-drain-timeout:PT5M}") Duration updateDrainTimeout) {
        this.lifecycleManager = lifecycleManager;
        this.taskScheduler = taskScheduler;
        this.liveUpdateManager = liveUpdateManager;
        this.metricsRegistry = metricsRegistry;
        this.structuredLogger = structuredLogger;
        this.updateDrainTimeout = updateDrainTimeout;
    }
    
    @Override
    public void onApplicationEvent(ContextClosedEvent event) {
        performGracefulShutdown();
    }
    
    public boolean isShuttingDown() {
        return shuttingDown.get();
    }
    
    public synchronized void performGracefulShutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            log.debug("Shutdown already in progress");
            return;
        }
        
        Instant start = Instant.now();
        log.info("========== GRACEFUL SHUTDOWN INITIATED ==========");
        
        log.info("[1/3] Refusing new work...");
        lifecycleManager.startDraining();
        
        log.info("[2/3] Stopping scheduler...");
        taskScheduler.shutdown();
        
        log.info("[3/3] Waiting for running live update...");
        boolean drained = waitForRunningUpdate();
        
        long durationMs = Duration.between(start, Instant.now()).toMillis();
        metricsRegistry.incrementCounter("lifecycle.shutdown", "status", drained ? "complete" : "update_abandoned");
        structuredLogger.lifecycle().shutdown(durationMs);
        lifecycleManager.markStopped();
        log.info("========== GRACEFUL SHUTDOWN COMPLETE ({} ms) ==========", durationMs);
    }
    
    private boolean waitForRunningUpdate() {
        Instant deadline = Instant.now().plus(updateDrainTimeout);
        try {
            while (liveUpdateManager.isRunning()) {
                if (Instant.now().isAfter(deadline)) {
                    log.warn("Live update still running after {}, shutting down anyway", updateDrainTimeout);
                    return false;
                }
                Thread.sleep(POLL_INTERVAL_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for live update");
            return false;
        }
        return true;
    }
}
