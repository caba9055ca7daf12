package com.platform.reconciler.system;

import java.util.List;

/**
 * Result of starting or stopping every eligible layer.
 */
public record SystemActionResult(
    boolean success,
    List<String> affectedLayers,
    List<String> errors
) {

    public SystemActionResult {
        affectedLayers = List.copyOf(affectedLayers);
        errors = List.copyOf(errors);
    }

    static SystemActionResult of(List<String> affectedLayers, List<String> errors) {
        return new SystemActionResult(errors.isEmpty(), affectedLayers, errors);
    }
}
