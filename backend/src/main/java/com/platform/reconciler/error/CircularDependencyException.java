package com.platform.reconciler.error;

import java.util.List;

/**
 * Layer dependency graph contains a cycle. Not retryable.
 */
public class CircularDependencyException extends ValidationException {
    
    private final List<String> unresolvedLayers;
    
    public CircularDependencyException(List<String> unresolvedLayers) {
        super(ErrorCode.CIRCULAR_DEPENDENCY, "layers", unresolvedLayers,
            "Circular dependency detected among layers: " + String.join(", ", unresolvedLayers));
        this.unresolvedLayers = List.copyOf(unresolvedLayers);
    }
    
    public List<String> getUnresolvedLayers() {
        return unresolvedLayers;
    }
}
