package com.platform.reconciler.core;

import com.platform.reconciler.model.ContainerRuntime;
import com.platform.reconciler.observability.MetricsRegistry;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Manages one circuit breaker per container runtime.
 * A runtime that keeps failing is short-circuited instead of spawning more doomed processes.
 */
@Slf4j
@Component
public class CircuitBreakerManager {
    
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final MetricsRegistry metricsRegistry;
    
    public CircuitBreakerManager(
            CircuitBreakerRegistry circuitBreakerRegistry,
            MetricsRegistry metricsRegistry) {
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.metricsRegistry = metricsRegistry;
    }
    
    @PostConstruct
    public void init() {
        for (ContainerRuntime runtime : ContainerRuntime.values()) {
            registerEventListeners(breaker(runtime), runtime);
        }
        
        log.info("CircuitBreakerManager initialized for {} runtimes", ContainerRuntime.values().length);
    }
    
    private void registerEventListeners(CircuitBreaker circuitBreaker, ContainerRuntime runtime) {
        circuitBreaker.getEventPublisher()
            .onStateTransition(event -> {
                String fromState = event.getStateTransition().getFromState().name();
                String toState = event.getStateTransition().getToState().name();
                
                log.info("Circuit breaker {} state change: {} -> {}", runtime.command(), fromState, toState);
                metricsRegistry.recordCircuitBreakerStateChange(runtime.command(), toState);
            })
            .onError(event -> log.debug("Circuit breaker {} recorded error: {}",
                runtime.command(), event.getThrowable().getMessage()));
    }
    
    /**
     * Run a runtime call through its breaker.
     *
     * @throws CallNotPermittedException when the breaker is open
     */
    public <T> T execute(ContainerRuntime runtime, Supplier<T> call) {
        return breaker(runtime).executeSupplier(call);
    }
    
    public String getState(ContainerRuntime runtime) {
        return breaker(runtime).getState().name();
    }
    
    /**
     * Get all circuit breaker states, keyed by runtime command.
     */
    public Map<String, CircuitBreakerStatus> getAllStates() {
        Map<String, CircuitBreakerStatus> states = new LinkedHashMap<>();
        
        for (ContainerRuntime runtime : ContainerRuntime.values()) {
            CircuitBreaker cb = breaker(runtime);
            CircuitBreaker.Metrics metrics = cb.getMetrics();
            
            states.put(runtime.command(), new CircuitBreakerStatus(
                cb.getState().name(),
                metrics.getNumberOfSuccessfulCalls(),
                metrics.getNumberOfFailedCalls(),
                metrics.getFailureRate()
            ));
        }
        
        return states;
    }
    
    /**
     * Reset circuit breaker (clear metrics and transition to closed).
     */
    public void reset(ContainerRuntime runtime) {
        breaker(runtime).reset();
        log.info("Reset circuit breaker {}", runtime.command());
    }
    
    private CircuitBreaker breaker(ContainerRuntime runtime) {
        return circuitBreakerRegistry.circuitBreaker("runtime-" + runtime.name().toLowerCase(Locale.ROOT));
    }
    
    /**
     * Circuit breaker status record.
     */
    public record CircuitBreakerStatus(
        String state,
        int successfulCalls,
        int failedCalls,
        float failureRate
    ) {}
}
