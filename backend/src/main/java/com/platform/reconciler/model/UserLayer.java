package com.platform.reconciler.model;

import java.util.List;

public record UserLayer(
    List<String> flatpaks,
    List<String> appImages,
    boolean autoUpdates
) {
    
    public UserLayer {
        flatpaks = flatpaks != null ? List.copyOf(flatpaks) : List.of();
        appImages = appImages != null ? List.copyOf(appImages) : List.of();
    }
}
