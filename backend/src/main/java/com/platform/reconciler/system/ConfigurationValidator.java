package com.platform.reconciler.system;

import com.platform.reconciler.container.ContainerManager;
import com.platform.reconciler.error.ValidationException;
import com.platform.reconciler.layer.LayerOrderResolver;
import com.platform.reconciler.model.ContainerSpec;
import com.platform.reconciler.model.SystemConfiguration;
import com.platform.reconciler.model.SystemLayer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural checks run before a deployment touches the host.
 */
@Component
public class ConfigurationValidator {

    private final LayerOrderResolver orderResolver;

    public ConfigurationValidator(LayerOrderResolver orderResolver) {
        this.orderResolver = orderResolver;
    }

    /**
     * Layer containers are checked together with top-level containers, so a layer can never
     * reuse the name of another container.
     *
     * @throws ValidationException on the first problem found, including a dependency on an undeclared layer
     * @throws com.platform.reconciler.error.CircularDependencyException if the layer graph has a cycle
     */
    public void validate(SystemConfiguration config) {
        String hostname = config.system().hostname();
        if (hostname == null || hostname.isBlank()) {
            throw new ValidationException("system.hostname", "hostname cannot be empty");
        }

        validateLayers(config.declaredLayers());
        validateContainers(allContainers(config));
        orderResolver.resolve(config.declaredLayers());
    }

    /**
     * Top-level containers followed by the ones wrapped in system layers. Both share one runtime namespace.
     */
    private static List<ContainerSpec> allContainers(SystemConfiguration config) {
        List<ContainerSpec> containers = new ArrayList<>(config.declaredContainers());
        config.declaredLayers().stream()
            .map(SystemLayer::container)
            .forEach(containers::add);
        return containers;
    }

    private void validateContainers(List<ContainerSpec> containers) {
        Set<String> seen = new HashSet<>();
        Map<String, String> binaryOwners = new HashMap<>();
        for (ContainerSpec container : containers) {
            if (container.name() == null || container.name().isBlank()) {
                throw new ValidationException("containers.name", "container name cannot be empty");
            }
            if (container.image() == null || container.image().isBlank()) {
                throw new ValidationException("containers.image", container.name(), "container image cannot be empty");
            }
            if (!seen.add(container.name())) {
                throw new ValidationException("containers.name", container.name(), "duplicate container name");
            }
            for (String binary : container.binaries()) {
                if (!ContainerManager.isPlainFileName(binary)) {
                    throw new ValidationException("containers.binaries", binary, "binary name must be a plain file name");
                }
                String owner = binaryOwners.putIfAbsent(binary, container.name());
                if (owner != null) {
                    throw new ValidationException("containers.binaries", binary,
                        "binary is exported by both " + owner + " and " + container.name());
                }
            }
        }
    }

    private void validateLayers(List<SystemLayer> layers) {
        Set<String> names = new HashSet<>();
        for (SystemLayer layer : layers) {
            if (layer.name() == null || layer.name().isBlank()) {
                throw new ValidationException("layers.name", "layer name cannot be empty");
            }
            if (!names.add(layer.name())) {
                throw new ValidationException("layers.name", layer.name(), "duplicate layer name");
            }
            if (layer.container() == null) {
                throw new ValidationException("layers.container", layer.name(), "system layer must declare a container");
            }
        }
    }
}
