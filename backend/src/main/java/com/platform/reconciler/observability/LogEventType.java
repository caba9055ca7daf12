package com.platform.reconciler.observability;

/**
 * Event types emitted through {@link StructuredLogger}.
 */
public enum LogEventType {
    
    // Live updates
    UPDATE_STARTED,
    UPDATE_CHANGE_APPLIED,
    UPDATE_CHANGE_FAILED,
    UPDATE_COMPLETED,
    UPDATE_BLOCKED,
    UPDATE_FAILED,
    ROLLBACK_STARTED,
    ROLLBACK_COMPLETED,
    ROLLBACK_FAILED,
    NOTIFICATION,
    
    // Containers
    CONTAINER_CREATED,
    CONTAINER_STARTED,
    CONTAINER_STOPPED,
    CONTAINER_REMOVED,
    CONTAINER_OPERATION_FAILED,
    
    // Layers
    LAYER_DEPLOYED,
    LAYER_FAILED,
    LAYER_STARTED,
    LAYER_STOPPED,
    
    // System
    SYSTEM_DEPLOYED,
    SYSTEM_HEALTH_CHANGED,
    APP_STARTUP,
    APP_SHUTDOWN,
    STATE_LOADED
}
