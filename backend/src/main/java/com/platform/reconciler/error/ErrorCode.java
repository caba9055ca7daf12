package com.platform.reconciler.error;

/**
 * Standardized error codes for the reconciler.
 * Each error has a unique code that clients can use to take specific actions.
 * 
 * Format: CP-{CATEGORY}{NUMBER}
 * Categories:
 * - 1xx: Configuration validation errors
 * - 3xx: Resource errors (not found, conflict)
 * - 4xx: Host and container runtime errors
 * - 6xx: Update and rollback errors
 * - 9xx: Internal errors (unexpected)
 */
public enum ErrorCode {
    
    // ==================== Validation Errors (1xx) ====================
    
    VALIDATION_ERROR("CP-100", "Validation error", ErrorCategory.RECOVERABLE),
    INVALID_REQUEST("CP-101", "Invalid request format", ErrorCategory.RECOVERABLE),
    MISSING_REQUIRED_FIELD("CP-102", "Missing required field", ErrorCategory.RECOVERABLE),
    INVALID_FIELD_VALUE("CP-103", "Invalid field value", ErrorCategory.RECOVERABLE),
    CONSTRAINT_VIOLATION("CP-104", "Constraint violation", ErrorCategory.RECOVERABLE),
    CIRCULAR_DEPENDENCY("CP-105", "Circular layer dependency", ErrorCategory.FATAL),
    
    // ==================== Resource Errors (3xx) ====================
    
    RESOURCE_NOT_FOUND("CP-300", "Resource not found", ErrorCategory.RECOVERABLE),
    CONTAINER_NOT_FOUND("CP-301", "Container not found", ErrorCategory.RECOVERABLE),
    LAYER_NOT_FOUND("CP-302", "Layer not found", ErrorCategory.RECOVERABLE),
    SNAPSHOT_NOT_FOUND("CP-303", "Snapshot not found", ErrorCategory.RECOVERABLE),
    RESOURCE_CONFLICT("CP-310", "Resource conflict", ErrorCategory.RECOVERABLE),
    DUPLICATE_RESOURCE("CP-311", "Duplicate resource", ErrorCategory.RECOVERABLE),
    UPDATE_IN_PROGRESS("CP-312", "Another update is in progress", ErrorCategory.RECOVERABLE),
    
    // ==================== Host / Runtime Errors (4xx) ====================
    
    COMMAND_FAILED("CP-440", "External command failed", ErrorCategory.RECOVERABLE),
    COMMAND_TIMEOUT("CP-441", "External command timed out", ErrorCategory.RECOVERABLE),
    RUNTIME_UNAVAILABLE("CP-442", "Container runtime unavailable", ErrorCategory.RECOVERABLE),
    CONTAINER_OPERATION_FAILED("CP-450", "Container operation failed", ErrorCategory.RECOVERABLE),
    STATE_SYNC_FAILED("CP-460", "State synchronization failed", ErrorCategory.RECOVERABLE),
    
    // ==================== Update Errors (6xx - Domain) ====================
    
    CHANGE_APPLY_FAILED("CP-600", "Failed to apply change", ErrorCategory.RECOVERABLE),
    LIVE_UPDATE_FAILED("CP-601", "Live update failed", ErrorCategory.RECOVERABLE),
    ROLLBACK_FAILED("CP-602", "Rollback failed, system state unknown", ErrorCategory.FATAL),
    PHASE_TRANSITION_INVALID("CP-620", "Invalid update phase transition", ErrorCategory.FATAL),
    
    // ==================== Internal Errors (9xx) ====================
    
    INTERNAL_ERROR("CP-900", "Internal server error", ErrorCategory.FATAL),
    UNEXPECTED_ERROR("CP-901", "Unexpected error occurred", ErrorCategory.FATAL),
    CONFIGURATION_ERROR("CP-902", "Configuration error", ErrorCategory.FATAL),
    SERIALIZATION_ERROR("CP-903", "Serialization error", ErrorCategory.RECOVERABLE);
    
    private final String code;
    private final String defaultMessage;
    private final ErrorCategory category;
    
    ErrorCode(String code, String defaultMessage, ErrorCategory category) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.category = category;
    }
    
    public String getCode() {
        return code;
    }
    
    public String getDefaultMessage() {
        return defaultMessage;
    }
    
    public ErrorCategory getCategory() {
        return category;
    }
    
    public boolean isFatal() {
        return category == ErrorCategory.FATAL;
    }
    
    public boolean isRecoverable() {
        return category == ErrorCategory.RECOVERABLE;
    }
    
    /**
     * Error category for distinguishing fatal vs recoverable errors.
     */
    public enum ErrorCategory {
        /**
         * Recoverable errors - client can retry or fix the request.
         */
        RECOVERABLE,
        
        /**
         * Fatal errors - system is in bad state, may require intervention.
         */
        FATAL
    }
}
