package com.platform.reconciler.error;

/**
 * Exception for resource not found errors.
 */
public class ResourceNotFoundException extends ReconcilerException {
    
    private final String resourceType;
    private final String resourceId;
    
    public ResourceNotFoundException(ErrorCode errorCode, String resourceType, String resourceId) {
        super(errorCode, String.format("%s not found: %s", resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }
    
    public static ResourceNotFoundException container(String name) {
        return new ResourceNotFoundException(ErrorCode.CONTAINER_NOT_FOUND, "Container", name);
    }
    
    public static ResourceNotFoundException layer(String name) {
        return new ResourceNotFoundException(ErrorCode.LAYER_NOT_FOUND, "Layer", name);
    }
    
    public static ResourceNotFoundException snapshot(String id) {
        return new ResourceNotFoundException(ErrorCode.SNAPSHOT_NOT_FOUND, "Snapshot", id);
    }
    
    public String getResourceType() {
        return resourceType;
    }
    
    public String getResourceId() {
        return resourceId;
    }
}
