package com.platform.reconciler.layer;

import com.platform.reconciler.container.ContainerManager;
import com.platform.reconciler.container.ContainerStatus;
import com.platform.reconciler.container.HealthStatus;
import com.platform.reconciler.error.ContainerOperationException;
import com.platform.reconciler.error.ResourceConflictException;
import com.platform.reconciler.error.ResourceNotFoundException;
import com.platform.reconciler.error.ValidationException;
import com.platform.reconciler.model.BaseLayer;
import com.platform.reconciler.model.LayerPurpose;
import com.platform.reconciler.model.LayerStrategy;
import com.platform.reconciler.model.LayersConfig;
import com.platform.reconciler.model.SystemLayer;
import com.platform.reconciler.model.UserLayer;
import com.platform.reconciler.observability.MetricsRegistry;
import com.platform.reconciler.observability.StructuredLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Deploys and toggles the layered software surface: one described base layer,
 * container-backed system layers and a described user layer.
 */
@Slf4j
@Component
public class LayerManager {

    static final String BASE_LAYER = "base";
    static final String USER_LAYER = "user";

    private final ContainerManager containerManager;
    private final LayerOrderResolver orderResolver;
    private final MetricsRegistry metricsRegistry;
    private final StructuredLogger structuredLogger;

    private final Map<String, LayerInfo> layers = new ConcurrentHashMap<>();
    private final Map<String, SystemLayer> specs = new ConcurrentHashMap<>();
    private volatile List<String> globalMounts = List.of();

    public LayerManager(
            ContainerManager containerManager,
            LayerOrderResolver orderResolver,
            MetricsRegistry metricsRegistry,
            StructuredLogger structuredLogger) {
        this.containerManager = containerManager;
        this.orderResolver = orderResolver;
        this.metricsRegistry = metricsRegistry;
        this.structuredLogger = structuredLogger;
    }

    // ==================== Deployment ====================

    /**
     * Deploy all layers: base first, then enabled system layers in dependency order, then user.
     * A layer whose dependency is disabled or failed is reported as failed without touching its container.
     *
     * @throws com.platform.reconciler.error.CircularDependencyException before anything is deployed
     */
    public synchronized List<LayerDeploymentResult> deployLayers(LayersConfig config) {
        List<SystemLayer> ordered = orderResolver.resolve(config.system());

        globalMounts = config.globalMounts();
        List<LayerDeploymentResult> results = new ArrayList<>();
        Set<String> available = new HashSet<>();

        if (config.base() != null) {
            results.add(describeBase(config.base()));
        }

        for (SystemLayer layer : ordered) {
            if (!layer.enabled()) {
                log.info("Skipping disabled layer {}", layer.name());
                continue;
            }
            LayerDeploymentResult result = layer.dependencies().stream()
                .filter(dependency -> !available.contains(dependency))
                .findFirst()
                .map(dependency -> dependencyFailure(layer, dependency))
                .orElseGet(() -> deploySystemLayer(layer));
            if (result.success()) {
                available.add(layer.name());
            }
            results.add(result);
            metricsRegistry.recordLayerDeployment(layer.name(), result.status().name());
            structuredLogger.layer().deployed(layer.name(), result.status().name(), layer.strategy().name());
        }

        if (config.user() != null) {
            results.add(describeUser(config.user()));
        }

        long failed = results.stream().filter(r -> !r.success()).count();
        log.info("Deployed {} layers ({} failed)", results.size(), failed);
        return results;
    }

    private LayerDeploymentResult dependencyFailure(SystemLayer layer, String dependency) {
        log.warn("Not deploying layer {}: dependency {} is not available", layer.name(), dependency);
        LayerInfo info = systemInfo(layer, LayerStatus.FAILED);
        layers.put(layer.name(), info);
        return LayerDeploymentResult.failed(info, "Dependency '" + dependency + "' not available");
    }

    private LayerDeploymentResult describeBase(BaseLayer base) {
        LayerInfo info = new LayerInfo(BASE_LAYER, LayerType.BASE, LayerPurpose.CUSTOM, null,
            LayerStatus.DEPLOYED, Instant.now(), List.of(), null, HealthStatus.HEALTHY);
        layers.put(BASE_LAYER, info);

        String reference = base.ostreeRef() != null ? base.ostreeRef() : base.image() + ":" + base.tag();
        return LayerDeploymentResult.deployed(info, "Base layer " + reference + " described");
    }

    private LayerDeploymentResult describeUser(UserLayer user) {
        LayerInfo info = new LayerInfo(USER_LAYER, LayerType.USER, LayerPurpose.CUSTOM, null,
            LayerStatus.DEPLOYED, Instant.now(), List.of(), null, HealthStatus.HEALTHY);
        layers.put(USER_LAYER, info);

        return LayerDeploymentResult.deployed(info, String.format("User layer described: %d flatpaks, %d AppImages",
            user.flatpaks().size(), user.appImages().size()));
    }

    private LayerDeploymentResult deploySystemLayer(SystemLayer layer) {
        if (layer.container() == null) {
            LayerInfo info = systemInfo(layer, LayerStatus.FAILED);
            layers.put(layer.name(), info);
            return LayerDeploymentResult.failed(info, "Layer " + layer.name() + " declares no container");
        }

        specs.put(layer.name(), layer);
        String containerName = layer.container().name();

        try {
            if (containerManager.get(containerName).isPresent()) {
                containerManager.remove(containerName, true);
            }

            if (layer.strategy() == LayerStrategy.EPHEMERAL) {
                LayerInfo info = systemInfo(layer, LayerStatus.DEPLOYED);
                layers.put(layer.name(), info);
                return LayerDeploymentResult.deployed(info, "Ephemeral layer " + layer.name() + " registered");
            }

            containerManager.create(layer.container(), globalMounts);
            containerManager.exportBinaries(layer.container());

            LayerStatus status = LayerStatus.DEPLOYED;
            if (layer.strategy() == LayerStrategy.ALWAYS_ON || layer.autoStart()) {
                containerManager.start(containerName);
                status = LayerStatus.RUNNING;
            }

            LayerInfo info = systemInfo(layer, status);
            layers.put(layer.name(), info);
            return LayerDeploymentResult.deployed(info, "System layer " + layer.name() + " deployed");
        } catch (ContainerOperationException | ResourceConflictException e) {
            log.error("Failed to deploy layer {}: {}", layer.name(), e.getMessage());
            LayerInfo info = systemInfo(layer, LayerStatus.FAILED);
            layers.put(layer.name(), info);
            return LayerDeploymentResult.failed(info, e.getMessage());
        }
    }

    private static LayerInfo systemInfo(SystemLayer layer, LayerStatus status) {
        String containerName = layer.container() != null ? layer.container().name() : null;
        return new LayerInfo(layer.name(), LayerType.SYSTEM, layer.purpose(), layer.strategy(),
            status, Instant.now(), layer.dependencies(), containerName, HealthStatus.UNKNOWN);
    }

    // ==================== Start / Stop ====================

    /**
     * Start a system layer. Ephemeral layers get a fresh container on every start.
     */
    public synchronized LayerInfo startLayer(String name) {
        LayerInfo info = requireSystemLayer(name);
        SystemLayer spec = specs.get(name);
        String containerName = info.containerName();

        if (info.strategy() == LayerStrategy.EPHEMERAL) {
            if (containerManager.get(containerName).isPresent()) {
                containerManager.remove(containerName, true);
            }
            containerManager.create(spec.container(), globalMounts);
            containerManager.exportBinaries(spec.container());
        }

        containerManager.start(containerName);
        LayerInfo started = info.withStatus(LayerStatus.RUNNING);
        layers.put(name, started);
        structuredLogger.layer().toggled(name, true);
        return started;
    }

    /**
     * Stop a system layer. Ephemeral layers have their container torn down.
     */
    public synchronized LayerInfo stopLayer(String name) {
        LayerInfo info = requireSystemLayer(name);
        String containerName = info.containerName();

        if (containerManager.get(containerName).isPresent()) {
            containerManager.stop(containerName);
            if (info.strategy() == LayerStrategy.EPHEMERAL) {
                containerManager.remove(containerName, true);
            }
        }

        LayerInfo stopped = info.withStatus(LayerStatus.STOPPED);
        layers.put(name, stopped);
        structuredLogger.layer().toggled(name, false);
        return stopped;
    }

    /**
     * Remove a layer and its container. Refused while another tracked layer depends on it.
     */
    public synchronized void removeLayer(String name) {
        LayerInfo info = layers.get(name);
        if (info == null) {
            throw ResourceNotFoundException.layer(name);
        }

        layers.values().stream()
            .filter(other -> other.dependencies().contains(name))
            .findFirst()
            .ifPresent(dependant -> {
                throw ResourceConflictException.layerInUse(name, dependant.name());
            });

        if (info.hasContainer() && containerManager.get(info.containerName()).isPresent()) {
            containerManager.remove(info.containerName(), true);
        }
        layers.remove(name);
        specs.remove(name);
        log.info("Removed layer {}", name);
    }

    // ==================== Queries ====================

    /**
     * Tracked layers with status and health refreshed from their containers.
     */
    public List<LayerInfo> listLayers() {
        return layers.values().stream()
            .map(this::refresh)
            .sorted(Comparator.comparing(LayerInfo::type).thenComparing(LayerInfo::name))
            .toList();
    }

    public LayerInfo getLayer(String name) {
        LayerInfo info = layers.get(name);
        if (info == null) {
            throw ResourceNotFoundException.layer(name);
        }
        return refresh(info);
    }

    public LayerOverview layerOverview() {
        List<LayerInfo> current = listLayers();

        Map<LayerStatus, Long> byStatus = new EnumMap<>(LayerStatus.class);
        byStatus.putAll(current.stream().collect(Collectors.groupingBy(LayerInfo::status, Collectors.counting())));

        Map<String, Long> byStrategy = new TreeMap<>(current.stream()
            .filter(info -> info.strategy() != null)
            .collect(Collectors.groupingBy(info -> info.strategy().name(), Collectors.counting())));

        Map<LayerType, Long> byType = new EnumMap<>(LayerType.class);
        byType.putAll(current.stream().collect(Collectors.groupingBy(LayerInfo::type, Collectors.counting())));

        return new LayerOverview(current.size(), byStatus, byStrategy, byType);
    }

    /**
     * Health per layer. Only always-on layers are expected to be running; others are healthy unless failed.
     */
    public Map<String, HealthStatus> layerHealth() {
        return listLayers().stream()
            .collect(Collectors.toMap(LayerInfo::name, LayerInfo::health, (a, b) -> a, LinkedHashMap::new));
    }

    private LayerInfo refresh(LayerInfo info) {
        if (!info.hasContainer()) {
            return info.status() == LayerStatus.FAILED ? info.withHealth(HealthStatus.UNHEALTHY) : info;
        }
        if (containerManager.get(info.containerName()).isEmpty()) {
            // Ephemeral layers have no container while stopped
            HealthStatus health = info.status() == LayerStatus.FAILED || info.strategy() == LayerStrategy.ALWAYS_ON
                ? HealthStatus.UNHEALTHY
                : HealthStatus.HEALTHY;
            return info.withHealth(health);
        }

        ContainerStatus containerStatus = containerManager.status(info.containerName());
        LayerStatus status = LayerStatus.fromContainerStatus(containerStatus);
        HealthStatus health = HealthStatus.fromContainerStatus(containerStatus);
        if (info.strategy() != LayerStrategy.ALWAYS_ON && status != LayerStatus.FAILED) {
            health = HealthStatus.HEALTHY;
        }

        LayerInfo refreshed = info.withStatus(status).withHealth(health);
        layers.computeIfPresent(info.name(), (name, existing) -> existing.withStatus(status));
        return refreshed;
    }

    private LayerInfo requireSystemLayer(String name) {
        LayerInfo info = layers.get(name);
        if (info == null) {
            throw ResourceNotFoundException.layer(name);
        }
        if (!info.hasContainer()) {
            throw new ValidationException("layer", name, "only container-backed system layers can be started or stopped");
        }
        return info;
    }
}
