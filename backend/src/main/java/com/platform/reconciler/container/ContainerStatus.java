package com.platform.reconciler.container;

import java.util.Locale;

public enum ContainerStatus {
    CREATED,
    RUNNING,
    STOPPED,
    PAUSED,
    EXITED,
    ERROR,
    UNKNOWN;
    
    /**
     * Map the runtime's {@code .State.Status} string.
     */
    public static ContainerStatus fromRuntimeState(String state) {
        if (state == null) {
            return UNKNOWN;
        }
        return switch (state.trim().toLowerCase(Locale.ROOT)) {
            case "created", "configured" -> CREATED;
            case "running" -> RUNNING;
            case "stopped" -> STOPPED;
            case "exited" -> EXITED;
            case "paused" -> PAUSED;
            default -> UNKNOWN;
        };
    }
}
