package com.platform.reconciler.container;

import java.util.Collection;

/**
 * Liveness-level health shared by containers, layers, services and the whole system.
 */
public enum HealthStatus {
    HEALTHY,
    UNHEALTHY,
    STARTING,
    UNKNOWN;
    
    public static HealthStatus fromContainerStatus(ContainerStatus status) {
        return switch (status) {
            case RUNNING -> HEALTHY;
            case CREATED -> STARTING;
            case STOPPED, EXITED, ERROR -> UNHEALTHY;
            case PAUSED, UNKNOWN -> UNKNOWN;
        };
    }
    
    /**
     * All healthy is HEALTHY, any unhealthy is UNHEALTHY, anything else is STARTING.
     * An empty collection counts as healthy.
     */
    public static HealthStatus reduce(Collection<HealthStatus> statuses) {
        if (statuses.stream().allMatch(s -> s == HEALTHY)) {
            return HEALTHY;
        }
        if (statuses.stream().anyMatch(s -> s == UNHEALTHY)) {
            return UNHEALTHY;
        }
        return STARTING;
    }
    
    /**
     * Gauge value: 2=healthy, 1=starting, 0=unhealthy or unknown.
     */
    public int gaugeValue() {
        return switch (this) {
            case HEALTHY -> 2;
            case STARTING -> 1;
            case UNHEALTHY, UNKNOWN -> 0;
        };
    }
}
