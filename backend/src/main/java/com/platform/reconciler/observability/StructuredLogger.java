package com.platform.reconciler.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Structured logger for reconciliation events.
 * 
 * REPLACES: log.info("container created")
 * WITH: structuredLogger.container().created(...)
 * 
 * All logs are JSON-formatted and machine-parsable.
 */
@Component
public class StructuredLogger {
    
    @Value("${reconciler.service-name:system-reconciler}")
    private String serviceName = "system-reconciler";
    
    @Value("${reconciler.environment:development}")
    private String environment = "development";
    
    /**
     * Get live update event logger.
     */
    public UpdateLogger update() {
        return new UpdateLogger(serviceName, environment);
    }
    
    /**
     * Get container event logger.
     */
    public ContainerLogger container() {
        return new ContainerLogger(serviceName, environment);
    }
    
    /**
     * Get layer event logger.
     */
    public LayerLogger layer() {
        return new LayerLogger(serviceName, environment);
    }
    
    /**
     * Get lifecycle event logger.
     */
    public LifecycleLogger lifecycle() {
        return new LifecycleLogger(serviceName, environment);
    }
    
    // ==================== UPDATE LOGGER ====================
    
    public static class UpdateLogger {
        private static final Logger log = LoggerFactory.getLogger("structured.update");
        private final String service;
        private final String environment;
        
        UpdateLogger(String service, String environment) {
            this.service = service;
            this.environment = environment;
        }
        
        public void started(String hostname, int packages, int services) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment, 
                    LogEventType.UPDATE_STARTED, "INFO")
                .actor("reconciler")
                .resourceType("System")
                .resourceId(hostname)
                .context(Map.of("packages", packages, "services", services))
                .build();
            log.info(event.toJson());
        }
        
        public void changeApplied(String changeType, String description, String impact) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment, 
                    LogEventType.UPDATE_CHANGE_APPLIED, "INFO")
                .actor("reconciler")
                .action(changeType)
                .success(true)
                .message(description)
                .context(Map.of("impact", impact))
                .build();
            log.info(event.toJson());
        }
        
        public void changeFailed(String changeType, String description, String errorCode, String errorMessage) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment, 
                    LogEventType.UPDATE_CHANGE_FAILED, "ERROR")
                .actor("reconciler")
                .action(changeType)
                .success(false)
                .message(description)
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .build();
            log.error(event.toJson());
        }
        
        public void blocked(int rebootRequiredChanges) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment, 
                    LogEventType.UPDATE_BLOCKED, "WARN")
                .actor("reconciler")
                .message("Reboot required before changes can be applied")
                .context(Map.of("reboot_required_changes", rebootRequiredChanges))
                .build();
            log.warn(event.toJson());
        }
        
        public void completed(String outcome, int applied, int failed, int pendingReboot, long durationMs) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment, 
                    LogEventType.UPDATE_COMPLETED, failed > 0 ? "WARN" : "INFO")
                .actor("reconciler")
                .action(outcome)
                .success(failed == 0)
                .durationMs(durationMs)
                .context(Map.of(
                    "applied", applied,
                    "failed", failed,
                    "pending_reboot", pendingReboot
                ))
                .build();
            if (failed > 0) {
                log.warn(event.toJson());
            } else {
                log.info(event.toJson());
            }
        }
        
        public void failed(String errorCode, String errorMessage, long durationMs) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment, 
                    LogEventType.UPDATE_FAILED, "ERROR")
                .actor("reconciler")
                .success(false)
                .durationMs(durationMs)
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .build();
            log.error(event.toJson());
        }
        
        public void rollback(LogEventType phase, String snapshotId, String errorMessage) {
            String level = phase == LogEventType.ROLLBACK_FAILED ? "ERROR" : "WARN";
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment, phase, level)
                .actor("reconciler")
                .resourceType("Snapshot")
                .resourceId(snapshotId)
                .success(phase == LogEventType.ROLLBACK_FAILED ? Boolean.FALSE : null)
                .errorMessage(errorMessage)
                .build();
            if (phase == LogEventType.ROLLBACK_FAILED) {
                log.error(event.toJson());
            } else {
                log.warn(event.toJson());
            }
        }
        
        public void notification(String level, String title, String message, boolean urgent) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment, 
                    LogEventType.NOTIFICATION, level)
                .actor("notifier")
                .message(title + ": " + message)
                .context(Map.of("urgent", urgent))
                .build();
            switch (level) {
                case "ERROR" -> log.error(event.toJson());
                case "WARN" -> log.warn(event.toJson());
                case "DEBUG" -> log.debug(event.toJson());
                default -> log.info(event.toJson());
            }
        }
    }
    
    // ==================== CONTAINER LOGGER ====================
    
    public static class ContainerLogger {
        private static final Logger log = LoggerFactory.getLogger("structured.container");
        private final String service;
        private final String environment;
        
        ContainerLogger(String service, String environment) {
            this.service = service;
            this.environment = environment;
        }
        
        public void lifecycle(LogEventType eventType, String name, String runtime, long durationMs) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment, eventType, "INFO")
                .actor("container-manager")
                .resourceType("Container")
                .resourceId(name)
                .action(runtime)
                .success(true)
                .durationMs(durationMs)
                .build();
            log.info(event.toJson());
        }
        
        public void operationFailed(String name, String step, String errorCode, String errorMessage) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment, 
                    LogEventType.CONTAINER_OPERATION_FAILED, "ERROR")
                .actor("container-manager")
                .resourceType("Container")
                .resourceId(name)
                .action(step)
                .success(false)
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .build();
            log.error(event.toJson());
        }
    }
    
    // ==================== LAYER LOGGER ====================
    
    public static class LayerLogger {
        private static final Logger log = LoggerFactory.getLogger("structured.layer");
        private final String service;
        private final String environment;
        
        LayerLogger(String service, String environment) {
            this.service = service;
            this.environment = environment;
        }
        
        public void deployed(String layer, String status, String strategy) {
            boolean failed = "FAILED".equals(status);
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment, 
                    failed ? LogEventType.LAYER_FAILED : LogEventType.LAYER_DEPLOYED, failed ? "ERROR" : "INFO")
                .actor("layer-manager")
                .resourceType("Layer")
                .resourceId(layer)
                .action(strategy)
                .success(!failed)
                .context(Map.of("status", status))
                .build();
            if (failed) {
                log.error(event.toJson());
            } else {
                log.info(event.toJson());
            }
        }
        
        public void toggled(String layer, boolean started) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment, 
                    started ? LogEventType.LAYER_STARTED : LogEventType.LAYER_STOPPED, "INFO")
                .actor("layer-manager")
                .resourceType("Layer")
                .resourceId(layer)
                .success(true)
                .build();
            log.info(event.toJson());
        }
    }
    
    // ==================== LIFECYCLE LOGGER ====================
    
    public static class LifecycleLogger {
        private static final Logger log = LoggerFactory.getLogger("structured.lifecycle");
        private final String service;
        private final String environment;
        
        LifecycleLogger(String service, String environment) {
            this.service = service;
            this.environment = environment;
        }
        
        public void systemDeployed(boolean success, int containers, int layers, int errors) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment, 
                    LogEventType.SYSTEM_DEPLOYED, success ? "INFO" : "WARN")
                .actor("system-manager")
                .success(success)
                .context(Map.of(
                    "containers_deployed", containers,
                    "layers_deployed", layers,
                    "errors", errors
                ))
                .build();
            if (success) {
                log.info(event.toJson());
            } else {
                log.warn(event.toJson());
            }
        }
        
        public void healthChanged(String previous, String current) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment, 
                    LogEventType.SYSTEM_HEALTH_CHANGED, "INFO")
                .actor("system-manager")
                .context(Map.of("previous", previous, "current", current))
                .build();
            log.info(event.toJson());
        }
        
        public void stateLoaded(String path, boolean found) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment, 
                    LogEventType.STATE_LOADED, "INFO")
                .actor("system")
                .resourceType("StateFile")
                .resourceId(path)
                .success(found)
                .build();
            log.info(event.toJson());
        }
        
        public void startup(String version) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment, 
                    LogEventType.APP_STARTUP, "INFO")
                .actor("system")
                .context(Map.of("version", version))
                .build();
            log.info(event.toJson());
        }
        
        public void shutdown(long durationMs) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment, 
                    LogEventType.APP_SHUTDOWN, "INFO")
                .actor("system")
                .durationMs(durationMs)
                .build();
            log.info(event.toJson());
        }
    }
}
