package com.platform.reconciler.observability;

import ch.qos.logback.classic.LoggerContext;
import jakarta.annotation.PostConstruct;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Logging configuration: correlation IDs for API requests and MDC helpers
 * for update runs and container operations.
 */
@Slf4j
@Configuration
public class LoggingConfig {
    
    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_UPDATE_ID = "updateId";
    public static final String MDC_OPERATION = "operation";
    public static final String MDC_TARGET = "target";
    
    @Value("${spring.application.name:system-reconciler}")
    private String applicationName;
    
    @PostConstruct
    public void init() {
        if (LoggerFactory.getILoggerFactory() instanceof LoggerContext context) {
            context.putProperty("application", applicationName);
        }
        
        log.info("Logging configuration initialized for application: {}", applicationName);
    }
    
    /**
     * Filter to add correlation ID to all requests.
     */
    @Bean
    public CorrelationIdFilter correlationIdFilter() {
        return new CorrelationIdFilter();
    }
    
    public static class CorrelationIdFilter extends OncePerRequestFilter {
        
        private static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
        
        @Override
        protected void doFilterInternal(
                HttpServletRequest request,
                HttpServletResponse response,
                FilterChain filterChain) throws ServletException, IOException {
            
            try {
                String correlationId = request.getHeader(CORRELATION_ID_HEADER);
                if (correlationId == null || correlationId.isBlank()) {
                    correlationId = UUID.randomUUID().toString();
                }
                
                MDC.put(MDC_CORRELATION_ID, correlationId);
                response.setHeader(CORRELATION_ID_HEADER, correlationId);
                
                filterChain.doFilter(request, response);
                
            } finally {
                MDC.remove(MDC_CORRELATION_ID);
            }
        }
    }
    
    /**
     * Tag log lines of the current thread with an update run id.
     */
    public static void setUpdateContext(String updateId) {
        MDC.put(MDC_UPDATE_ID, updateId);
    }
    
    public static void clearUpdateContext() {
        MDC.remove(MDC_UPDATE_ID);
    }
    
    /**
     * Set operation context for detailed logging.
     */
    public static void setOperationContext(String operation, String target) {
        MDC.put(MDC_OPERATION, operation);
        MDC.put(MDC_TARGET, target);
    }
    
    /**
     * Clear operation context.
     */
    public static void clearOperationContext() {
        MDC.remove(MDC_OPERATION);
        MDC.remove(MDC_TARGET);
    }
}
