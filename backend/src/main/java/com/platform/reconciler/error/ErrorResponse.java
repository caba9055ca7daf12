package com.platform.reconciler.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Error body returned by every API endpoint on failure.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    
    /**
     * Error code (e.g., CP-301).
     */
    private String code;
    
    private String message;
    
    /**
     * Underlying cause, when there is one worth showing.
     */
    private String detail;
    
    /**
     * Whether the host may be left in an unknown state and needs an operator.
     */
    private boolean fatal;
    
    private int status;
    
    private Instant timestamp;
    
    private String path;
    
    /**
     * Correlation ID of the request, for matching against logs.
     */
    private String correlationId;
    
    private List<FieldError> fieldErrors;
    
    private Map<String, Object> metadata;
    
    @Data
    @Builder
    public static class FieldError {
        private String field;
        private String message;
        private Object rejectedValue;
    }
}
