package com.platform.reconciler.api;

import com.platform.reconciler.container.ContainerInfo;
import com.platform.reconciler.container.ContainerManager;
import com.platform.reconciler.container.ContainerStats;
import com.platform.reconciler.container.ContainerStatus;
import com.platform.reconciler.container.HealthStatus;
import com.platform.reconciler.core.CircuitBreakerManager;
import com.platform.reconciler.error.ResourceNotFoundException;
import com.platform.reconciler.model.ContainerRuntime;
import com.platform.reconciler.system.SystemManager;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST API for registered containers and the runtimes behind them.
 */
@RestController
@RequestMapping("/api/containers")
public class ContainerController {
    
    private final ContainerManager containerManager;
    private final CircuitBreakerManager circuitBreakerManager;
    private final SystemManager systemManager;
    
    public ContainerController(
            ContainerManager containerManager,
            CircuitBreakerManager circuitBreakerManager,
            SystemManager systemManager) {
        this.containerManager = containerManager;
        this.circuitBreakerManager = circuitBreakerManager;
        this.systemManager = systemManager;
    }
    
    @GetMapping
    public List<ContainerInfo> list() {
        return containerManager.list();
    }
    
    /**
     * Availability of each runtime binary plus its circuit breaker.
     */
    @GetMapping("/runtimes")
    public Map<String, Object> runtimes() {
        Map<String, Object> body = new LinkedHashMap<>();
        Map<String, Boolean> available = new LinkedHashMap<>();
        for (ContainerRuntime runtime : ContainerRuntime.values()) {
            available.put(runtime.name(), containerManager.isRuntimeAvailable(runtime));
        }
        body.put("default", containerManager.defaultRuntime());
        body.put("available", available);
        body.put("circuitBreakers", circuitBreakerManager.getAllStates());
        return body;
    }
    
    @GetMapping("/{name}")
    public ContainerInfo get(@PathVariable String name) {
        return containerManager.get(name).orElseThrow(() -> ResourceNotFoundException.container(name));
    }
    
    @GetMapping("/{name}/status")
    public Map<String, ContainerStatus> status(@PathVariable String name) {
        return Map.of("status", containerManager.status(name));
    }
    
    @GetMapping("/{name}/health")
    public Map<String, HealthStatus> health(@PathVariable String name) {
        return Map.of("health", containerManager.healthCheck(name));
    }
    
    @GetMapping("/{name}/stats")
    public ContainerStats stats(@PathVariable String name) {
        return containerManager.stats(name);
    }
    
    @GetMapping(value = "/{name}/logs", produces = MediaType.TEXT_PLAIN_VALUE)
    public String logs(@PathVariable String name, @RequestParam(defaultValue = "100") int tail) {
        return systemManager.containerLogs(name, tail);
    }
}
