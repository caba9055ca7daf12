package com.platform.reconciler.error;

/**
 * Operation conflicts with the current state of a resource.
 */
public class ResourceConflictException extends ReconcilerException {
    
    private final String resourceId;
    
    public ResourceConflictException(ErrorCode errorCode, String resourceId, String message) {
        super(errorCode, message);
        this.resourceId = resourceId;
    }
    
    public static ResourceConflictException duplicateContainer(String name) {
        return new ResourceConflictException(ErrorCode.DUPLICATE_RESOURCE, name,
            "Container already registered: " + name);
    }
    
    public static ResourceConflictException layerInUse(String name, String dependant) {
        return new ResourceConflictException(ErrorCode.RESOURCE_CONFLICT, name,
            String.format("Layer %s is required by %s", name, dependant));
    }
    
    public static ResourceConflictException binaryExported(String binary, String owner) {
        return new ResourceConflictException(ErrorCode.RESOURCE_CONFLICT, binary,
            String.format("Binary %s is already exported by container %s", binary, owner));
    }
    
    public static ResourceConflictException updateInProgress() {
        return new ResourceConflictException(ErrorCode.UPDATE_IN_PROGRESS, "live-update",
            ErrorCode.UPDATE_IN_PROGRESS.getDefaultMessage());
    }
    
    public String getResourceId() {
        return resourceId;
    }
}
