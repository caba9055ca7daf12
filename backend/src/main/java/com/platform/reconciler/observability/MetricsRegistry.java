package com.platform.reconciler.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Central registry for all application metrics.
 * Provides methods for recording reconciliation, container and layer metrics.
 */
@Slf4j
@Component
public class MetricsRegistry {
    
    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> counters;
    private final Map<String, Timer> timers;
    private final Map<String, AtomicInteger> gaugeValues;
    
    public MetricsRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.counters = new ConcurrentHashMap<>();
        this.timers = new ConcurrentHashMap<>();
        this.gaugeValues = new ConcurrentHashMap<>();
        
        initializeMetrics();
    }
    
    private void initializeMetrics() {
        Gauge.builder("reconciler.containers.registered", () -> gauge("containers.registered").get())
            .register(meterRegistry);
        Gauge.builder("reconciler.health.status", () -> gauge("health.status").get())
            .description("2=healthy, 1=starting, 0=unhealthy")
            .register(meterRegistry);
        
        log.info("Metrics registry initialized");
    }
    
    private AtomicInteger gauge(String key) {
        return gaugeValues.computeIfAbsent(key, k -> new AtomicInteger(0));
    }
    
    /**
     * Record latency for an operation.
     */
    public void recordLatency(String component, String operation, long latencyMs) {
        String timerKey = component + "." + operation;
        Timer timer = timers.computeIfAbsent(timerKey, k -> 
            Timer.builder("reconciler.operation.latency")
                .tag("component", component)
                .tag("operation", operation)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry));
        
        timer.record(Duration.ofMillis(latencyMs));
    }
    
    /**
     * Increment a counter.
     */
    public void incrementCounter(String name) {
        counters.computeIfAbsent(name, k -> 
            Counter.builder(name)
                .register(meterRegistry))
            .increment();
    }
    
    /**
     * Increment a counter with tags.
     */
    public void incrementCounter(String name, String... tags) {
        String key = name + String.join(".", tags);
        counters.computeIfAbsent(key, k -> 
            Counter.builder(name)
                .tags(tags)
                .register(meterRegistry))
            .increment();
    }
    
    public void recordChangesDetected(String changeType, int count) {
        for (int i = 0; i < count; i++) {
            incrementCounter("reconciler.changes.detected", "type", changeType);
        }
    }
    
    public void recordChangeApplied(String changeType, String strategy) {
        incrementCounter("reconciler.changes.applied", "type", changeType, "strategy", strategy);
    }
    
    public void recordChangeFailed(String changeType, String strategy) {
        incrementCounter("reconciler.changes.failed", "type", changeType, "strategy", strategy);
    }
    
    /**
     * Record the outcome of a live update run.
     */
    public void recordUpdateResult(String outcome, long durationMs) {
        incrementCounter("reconciler.update.result", "outcome", outcome);
        recordLatency("live-update", "apply", durationMs);
        log.debug("Recorded update result: {} in {}ms", outcome, durationMs);
    }
    
    public void recordRollback(boolean success) {
        incrementCounter("reconciler.rollback", "success", String.valueOf(success));
    }
    
    public void recordContainerOperation(String runtime, String operation, boolean success) {
        incrementCounter("reconciler.container.operation", 
            "runtime", runtime, "operation", operation, "success", String.valueOf(success));
    }
    
    public void recordLayerDeployment(String layer, String status) {
        incrementCounter("reconciler.layer.deploy", "layer", layer, "status", status);
    }
    
    /**
     * Record circuit breaker state change.
     */
    public void recordCircuitBreakerStateChange(String runtime, String state) {
        incrementCounter("reconciler.circuitbreaker.state", "runtime", runtime, "state", state);
    }
    
    public void updateRegisteredContainers(int count) {
        gauge("containers.registered").set(count);
    }
    
    /**
     * Set overall health: 2=healthy, 1=starting, 0=unhealthy.
     */
    public void setHealthStatus(int value) {
        gauge("health.status").set(value);
    }
    
    public int getHealthStatus() {
        return gauge("health.status").get();
    }
    
    /**
     * Record an update phase transition.
     */
    public void recordPhaseTransition(Object fromPhase, Object toPhase) {
        String from = fromPhase != null ? fromPhase.toString() : "null";
        String to = toPhase != null ? toPhase.toString() : "unknown";
        
        incrementCounter("reconciler.update.phase.transition", "from", from, "to", to);
        log.debug("Recorded phase transition: {} -> {}", from, to);
    }
}
