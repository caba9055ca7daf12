package com.platform.reconciler.lifecycle;

import com.platform.reconciler.observability.StructuredLogger;
import com.platform.reconciler.system.SystemManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Loads the persisted system state and marks the application ready.
 */
@Slf4j
@Component
public class ApplicationStartupListener {
    
    private final ApplicationLifecycleManager lifecycleManager;
    private final SystemManager systemManager;
    private final StructuredLogger structuredLogger;
    private final String version;
    
    public ApplicationStartupListener(
            ApplicationLifecycleManager lifecycleManager,
            SystemManager systemManager,
            StructuredLogger structuredLogger,
            @Value("${reconciler.version:1.0.0}") String version) {
        this.lifecycleManager = lifecycleManager;
        this.systemManager = systemManager;
        this.structuredLogger = structuredLogger;
        this.version = version;
    }
    
    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady(ApplicationReadyEvent event) {
        boolean found = systemManager.loadPersistedState();
        log.info("Application startup complete (persisted state {}), marking as ready", found ? "loaded" : "absent");
        structuredLogger.lifecycle().startup(version);
        lifecycleManager.markReady();
    }
}
