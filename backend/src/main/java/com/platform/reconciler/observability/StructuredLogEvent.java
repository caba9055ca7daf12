package com.platform.reconciler.observability;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.Builder;
import lombok.Data;
import org.slf4j.MDC;

import java.time.Instant;
import java.util.Map;

/**
 * Structured log event schema.
 * 
 * Mandatory fields:
 * - timestamp (RFC3339)
 * - level
 * - service
 * - environment
 * - event_type
 * - actor
 * 
 * Optional contextual fields from MDC:
 * - update_id
 * - correlation_id
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StructuredLogEvent {
    
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    
    // Mandatory fields
    private String timestamp;
    private String level;
    private String service;
    private String environment;
    private LogEventType eventType;
    private String actor;
    
    // Context (from MDC)
    private String updateId;
    private String correlationId;
    
    // Event-specific data
    private String message;
    private String resourceType;
    private String resourceId;
    private String action;
    private Boolean success;
    private Long durationMs;
    private String errorCode;
    private String errorMessage;
    
    // Additional context
    private Map<String, Object> context;
    
    /**
     * Convert to JSON string for logging.
     */
    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            return String.format("{\"eventType\":\"%s\",\"message\":\"%s\",\"error\":\"serialization_failed\"}", 
                eventType, message);
        }
    }
    
    /**
     * Create builder with mandatory fields from context.
     */
    public static StructuredLogEventBuilder fromContext(
            String service, String environment, LogEventType eventType, String level) {
        
        return StructuredLogEvent.builder()
            .timestamp(Instant.now().toString())
            .level(level)
            .service(service)
            .environment(environment)
            .eventType(eventType)
            .updateId(MDC.get(LoggingConfig.MDC_UPDATE_ID))
            .correlationId(MDC.get(LoggingConfig.MDC_CORRELATION_ID));
    }
}
