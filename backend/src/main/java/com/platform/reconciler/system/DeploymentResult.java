package com.platform.reconciler.system;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of deploying containers and layers from a configuration.
 */
public record DeploymentResult(
    boolean success,
    String message,
    Instant timestamp,
    int containersDeployed,
    int layersDeployed,
    List<String> errors
) {

    public DeploymentResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public static DeploymentResult of(int containersDeployed, int layersDeployed, List<String> errors) {
        boolean success = errors.isEmpty();
        String message = success
            ? "System deployed successfully"
            : "System deployed with " + errors.size() + " errors";
        return new DeploymentResult(success, message, Instant.now(), containersDeployed, layersDeployed, errors);
    }

    public static DeploymentResult failed(String error) {
        return new DeploymentResult(false, "System deployment failed: " + error, Instant.now(), 0, 0, List.of(error));
    }
}
