package com.platform.reconciler.error;

/**
 * Exception for container lifecycle failures. Names the failed sub-step.
 */
public class ContainerOperationException extends ReconcilerException {
    
    private final String containerName;
    private final String step;
    
    public ContainerOperationException(String containerName, String step, String message, Throwable cause) {
        super(ErrorCode.CONTAINER_OPERATION_FAILED, 
            String.format("Container %s failed at step '%s': %s", containerName, step, message), cause);
        this.containerName = containerName;
        this.step = step;
    }
    
    public static ContainerOperationException runtimeUnavailable(String containerName, String runtime, Throwable cause) {
        return new ContainerOperationException(containerName, "runtime", 
            "runtime " + runtime + " is not available", cause);
    }
    
    public String getContainerName() {
        return containerName;
    }
    
    public String getStep() {
        return step;
    }
}
