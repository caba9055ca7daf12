package com.platform.reconciler.layer;

/**
 * Outcome of deploying one layer.
 */
public record LayerDeploymentResult(
    String layer,
    boolean success,
    String message,
    LayerInfo layerInfo
) {
    
    public static LayerDeploymentResult deployed(LayerInfo info, String message) {
        return new LayerDeploymentResult(info.name(), true, message, info);
    }
    
    public static LayerDeploymentResult failed(LayerInfo info, String message) {
        return new LayerDeploymentResult(info.name(), false, message, info);
    }
    
    public LayerStatus status() {
        return layerInfo != null ? layerInfo.status() : LayerStatus.UNKNOWN;
    }
}
