package com.platform.reconciler.layer;

import com.platform.reconciler.container.ContainerStatus;

public enum LayerStatus {
    DEPLOYED,
    STARTING,
    RUNNING,
    STOPPED,
    FAILED,
    UPDATING,
    UNKNOWN;
    
    public static LayerStatus fromContainerStatus(ContainerStatus status) {
        return switch (status) {
            case RUNNING -> RUNNING;
            case STOPPED, EXITED -> STOPPED;
            case CREATED -> DEPLOYED;
            case ERROR -> FAILED;
            case PAUSED, UNKNOWN -> UNKNOWN;
        };
    }
}
