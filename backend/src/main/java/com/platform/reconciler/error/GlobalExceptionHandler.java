package com.platform.reconciler.error;

import com.platform.reconciler.observability.LoggingConfig;
import com.platform.reconciler.observability.MetricsRegistry;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Converts exceptions from the REST layer into {@link ErrorResponse} bodies.
 * 
 * Every handled error is logged (WARN when recoverable, ERROR when fatal)
 * and counted in the {@code errors} counter tagged by code.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {
    
    private final MetricsRegistry metricsRegistry;
    
    public GlobalExceptionHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }
    
    // ==================== Reconciler Exceptions ====================
    
    @ExceptionHandler(ReconcilerException.class)
    public ResponseEntity<ErrorResponse> handleReconcilerException(
            ReconcilerException ex, HttpServletRequest request) {
        
        String correlationId = getOrCreateCorrelationId();
        ErrorCode errorCode = ex.getErrorCode();
        HttpStatus status = mapErrorCodeToStatus(errorCode);
        
        logError(ex, errorCode, correlationId);
        recordMetric(errorCode);
        
        ErrorResponse.ErrorResponseBuilder builder = base(errorCode, ex.getMessage(), status, request, correlationId);
        if (ex.getCause() != null && ex.getCause() != ex) {
            builder.detail(ex.getCause().getMessage());
        }
        if (ex instanceof RollbackFailedException rollback) {
            builder.metadata(Map.of("snapshotId", rollback.getSnapshotId()));
        }
        
        return ResponseEntity.status(status).body(builder.build());
    }
    
    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFound(
            ResourceNotFoundException ex, HttpServletRequest request) {
        
        String correlationId = getOrCreateCorrelationId();
        
        log.warn("[{}] Resource not found: {} ({})", 
            correlationId, ex.getResourceType(), ex.getResourceId());
        recordMetric(ex.getErrorCode());
        
        ErrorResponse response = base(ex.getErrorCode(), ex.getMessage(), HttpStatus.NOT_FOUND, request, correlationId)
            .metadata(Map.of(
                "resourceType", ex.getResourceType(),
                "resourceId", ex.getResourceId()
            ))
            .build();
        
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
    }
    
    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(
            ValidationException ex, HttpServletRequest request) {
        
        String correlationId = getOrCreateCorrelationId();
        HttpStatus status = mapErrorCodeToStatus(ex.getErrorCode());
        
        logError(ex, ex.getErrorCode(), correlationId);
        recordMetric(ex.getErrorCode());
        
        ErrorResponse.ErrorResponseBuilder builder = base(ex.getErrorCode(), ex.getMessage(), status, request, correlationId);
        
        if (ex.getField() != null) {
            builder.fieldErrors(List.of(
                ErrorResponse.FieldError.builder()
                    .field(ex.getField())
                    .message(ex.getMessage())
                    .rejectedValue(ex.getRejectedValue())
                    .build()
            ));
        }
        
        return ResponseEntity.status(status).body(builder.build());
    }
    
    // ==================== Request Errors ====================
    
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        
        String correlationId = getOrCreateCorrelationId();
        
        List<ErrorResponse.FieldError> fieldErrors = ex.getBindingResult()
            .getFieldErrors()
            .stream()
            .map(fe -> ErrorResponse.FieldError.builder()
                .field(fe.getField())
                .message(fe.getDefaultMessage())
                .rejectedValue(fe.getRejectedValue())
                .build())
            .toList();
        
        log.warn("[{}] Validation failed: {} field errors", correlationId, fieldErrors.size());
        recordMetric(ErrorCode.VALIDATION_ERROR);
        
        ErrorResponse response = base(ErrorCode.VALIDATION_ERROR, "Validation failed", HttpStatus.BAD_REQUEST,
                request, correlationId)
            .fieldErrors(fieldErrors)
            .build();
        
        return ResponseEntity.badRequest().body(response);
    }
    
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleHttpMessageNotReadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        
        String correlationId = getOrCreateCorrelationId();
        
        log.warn("[{}] Invalid request body: {}", correlationId, ex.getMessage());
        recordMetric(ErrorCode.INVALID_REQUEST);
        
        ErrorResponse response = base(ErrorCode.INVALID_REQUEST, "Invalid request body", HttpStatus.BAD_REQUEST,
                request, correlationId)
            .detail(ex.getMostSpecificCause().getMessage())
            .build();
        
        return ResponseEntity.badRequest().body(response);
    }
    
    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(
            MissingServletRequestParameterException ex, HttpServletRequest request) {
        
        String correlationId = getOrCreateCorrelationId();
        
        log.warn("[{}] Missing parameter: {}", correlationId, ex.getParameterName());
        recordMetric(ErrorCode.MISSING_REQUIRED_FIELD);
        
        ErrorResponse response = base(ErrorCode.MISSING_REQUIRED_FIELD,
                String.format("Missing required parameter: %s", ex.getParameterName()),
                HttpStatus.BAD_REQUEST, request, correlationId)
            .build();
        
        return ResponseEntity.badRequest().body(response);
    }
    
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        
        String correlationId = getOrCreateCorrelationId();
        
        log.warn("[{}] Type mismatch: {} = {}", correlationId, ex.getName(), ex.getValue());
        recordMetric(ErrorCode.INVALID_FIELD_VALUE);
        
        ErrorResponse response = base(ErrorCode.INVALID_FIELD_VALUE,
                String.format("Invalid value for parameter '%s': %s", ex.getName(), ex.getValue()),
                HttpStatus.BAD_REQUEST, request, correlationId)
            .build();
        
        return ResponseEntity.badRequest().body(response);
    }
    
    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotSupported(
            HttpRequestMethodNotSupportedException ex, HttpServletRequest request) {
        
        String correlationId = getOrCreateCorrelationId();
        
        log.warn("[{}] Method not supported: {} on {}", correlationId, ex.getMethod(), request.getRequestURI());
        recordMetric(ErrorCode.INVALID_REQUEST);
        
        ErrorResponse response = base(ErrorCode.INVALID_REQUEST,
                String.format("Method %s not supported for this endpoint", ex.getMethod()),
                HttpStatus.METHOD_NOT_ALLOWED, request, correlationId)
            .build();
        
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED).body(response);
    }
    
    // ==================== Catch-All ====================
    
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex, HttpServletRequest request) {
        
        String correlationId = getOrCreateCorrelationId();
        
        log.error("[{}] FATAL: Unexpected error: {}", correlationId, ex.getMessage(), ex);
        recordMetric(ErrorCode.UNEXPECTED_ERROR);
        
        ErrorResponse response = base(ErrorCode.UNEXPECTED_ERROR, "An unexpected error occurred",
                HttpStatus.INTERNAL_SERVER_ERROR, request, correlationId)
            .detail(ex.getClass().getSimpleName() + ": " + ex.getMessage())
            .build();
        
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }
    
    // ==================== Helpers ====================
    
    private ErrorResponse.ErrorResponseBuilder base(ErrorCode errorCode, String message, HttpStatus status,
                                                   HttpServletRequest request, String correlationId) {
        return ErrorResponse.builder()
            .code(errorCode.getCode())
            .message(message)
            .fatal(errorCode.isFatal())
            .status(status.value())
            .timestamp(Instant.now())
            .path(request.getRequestURI())
            .correlationId(correlationId);
    }
    
    private String getOrCreateCorrelationId() {
        String correlationId = MDC.get(LoggingConfig.MDC_CORRELATION_ID);
        if (correlationId == null) {
            correlationId = UUID.randomUUID().toString().substring(0, 8);
            MDC.put(LoggingConfig.MDC_CORRELATION_ID, correlationId);
        }
        return correlationId;
    }
    
    private void logError(ReconcilerException ex, ErrorCode errorCode, String correlationId) {
        if (errorCode.isFatal()) {
            log.error("[{}] FATAL: {} - {}", correlationId, errorCode.getCode(), ex.getMessage(), ex);
        } else {
            log.warn("[{}] {} - {}", correlationId, errorCode.getCode(), ex.getMessage());
        }
    }
    
    private void recordMetric(ErrorCode errorCode) {
        metricsRegistry.incrementCounter("errors",
            "code", errorCode.getCode(),
            "fatal", String.valueOf(errorCode.isFatal()));
    }
    
    static HttpStatus mapErrorCodeToStatus(ErrorCode errorCode) {
        return switch (errorCode) {
            case RESOURCE_NOT_FOUND, CONTAINER_NOT_FOUND, LAYER_NOT_FOUND, SNAPSHOT_NOT_FOUND ->
                HttpStatus.NOT_FOUND;
            case RESOURCE_CONFLICT, DUPLICATE_RESOURCE, UPDATE_IN_PROGRESS ->
                HttpStatus.CONFLICT;
            case VALIDATION_ERROR, INVALID_REQUEST, MISSING_REQUIRED_FIELD, INVALID_FIELD_VALUE, CONSTRAINT_VIOLATION ->
                HttpStatus.BAD_REQUEST;
            case CIRCULAR_DEPENDENCY ->
                HttpStatus.UNPROCESSABLE_ENTITY;
            case RUNTIME_UNAVAILABLE ->
                HttpStatus.SERVICE_UNAVAILABLE;
            case COMMAND_TIMEOUT ->
                HttpStatus.GATEWAY_TIMEOUT;
            case COMMAND_FAILED, CONTAINER_OPERATION_FAILED ->
                HttpStatus.BAD_GATEWAY;
            default ->
                HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
