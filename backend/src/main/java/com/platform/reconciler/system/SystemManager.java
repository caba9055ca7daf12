package com.platform.reconciler.system;

import com.platform.reconciler.container.ContainerInfo;
import com.platform.reconciler.container.ContainerManager;
import com.platform.reconciler.container.HealthStatus;
import com.platform.reconciler.error.ReconcilerException;
import com.platform.reconciler.host.HostOperations;
import com.platform.reconciler.layer.LayerDeploymentResult;
import com.platform.reconciler.layer.LayerInfo;
import com.platform.reconciler.layer.LayerManager;
import com.platform.reconciler.layer.LayerStatus;
import com.platform.reconciler.layer.LayerType;
import com.platform.reconciler.model.ContainerSpec;
import com.platform.reconciler.model.ReproducibleConfig;
import com.platform.reconciler.model.SystemConfiguration;
import com.platform.reconciler.observability.MetricsRegistry;
import com.platform.reconciler.observability.StructuredLogger;
import com.platform.reconciler.snapshot.StateSyncManager;
import com.platform.reconciler.update.LiveUpdateManager;
import com.platform.reconciler.update.LiveUpdateOptions;
import com.platform.reconciler.update.LiveUpdateResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Top-level entry point: deploys containers and layers, reports aggregated health
 * and routes configuration updates through the live update manager.
 */
@Slf4j
@Service
public class SystemManager {

    private final ConfigurationValidator validator;
    private final ContainerManager containerManager;
    private final LayerManager layerManager;
    private final LiveUpdateManager liveUpdateManager;
    private final StateSyncManager stateSync;
    private final SystemStateStore stateStore;
    private final HostOperations host;
    private final MetricsRegistry metricsRegistry;
    private final StructuredLogger structuredLogger;
    private final List<String> expectedServices;

    private final AtomicReference<SystemHealthReport> lastHealth = new AtomicReference<>(SystemHealthReport.unknown());
    private volatile ReproducibleConfig reproducible;

    public SystemManager(
            ConfigurationValidator validator,
            ContainerManager containerManager,
            LayerManager layerManager,
            LiveUpdateManager liveUpdateManager,
            StateSyncManager stateSync,
            SystemStateStore stateStore,
            HostOperations host,
            MetricsRegistry metricsRegistry,
            StructuredLogger structuredLogger,
            @Value("${reconciler.health.expected-services:systemd-networkd,systemd-resolved,podman.socket,flatpak-system-helper}")
            List<String> expectedServices) {
        this.validator = validator;
        this.containerManager = containerManager;
        this.layerManager = layerManager;
        this.liveUpdateManager = liveUpdateManager;
        this.stateSync = stateSync;
        this.stateStore = stateStore;
        this.host = host;
        this.metricsRegistry = metricsRegistry;
        this.structuredLogger = structuredLogger;
        this.expectedServices = List.copyOf(expectedServices);
    }

    // ==================== Deployment ====================

    /**
     * Deploy containers, then layers, then persist the system state record.
     * Individual container or layer failures are collected into the result.
     *
     * @throws com.platform.reconciler.error.ValidationException before anything is touched
     * @throws com.platform.reconciler.error.CircularDependencyException before anything is touched
     */
    public DeploymentResult deploySystem(SystemConfiguration config) {
        validator.validate(config);
        log.info("Starting system deployment for host {}", config.system().hostname());

        List<String> errors = new ArrayList<>();
        int containersDeployed = 0;
        int layersDeployed = 0;

        try {
            if (config.containers() != null) {
                List<ContainerInfo> deployed = containerManager.deployContainers(config.containers());
                containersDeployed = deployed.size();

                Set<String> deployedNames = deployed.stream().map(ContainerInfo::name).collect(Collectors.toSet());
                config.containers().containers().stream()
                    .map(ContainerSpec::name)
                    .filter(name -> !deployedNames.contains(name))
                    .forEach(name -> errors.add("Container " + name + " failed to deploy"));
            }

            if (config.layers() != null) {
                List<LayerDeploymentResult> results = layerManager.deployLayers(config.layers());
                layersDeployed = (int) results.stream().filter(LayerDeploymentResult::success).count();
                results.stream()
                    .filter(result -> !result.success())
                    .forEach(result -> errors.add(result.message()));
            }

            if (config.reproducible() != null && config.reproducible().enabled()) {
                log.info("Recording reproducible pin {} (strict={})",
                    config.reproducible().pinnedBase(), config.reproducible().strictMode());
            }
            reproducible = config.reproducible();

            stateStore.save(currentState());
        } catch (ReconcilerException e) {
            log.error("System deployment failed: {}", e.getMessage());
            structuredLogger.lifecycle().systemDeployed(false, containersDeployed, layersDeployed, errors.size() + 1);
            return DeploymentResult.failed(e.getMessage());
        }

        DeploymentResult result = DeploymentResult.of(containersDeployed, layersDeployed, errors);
        structuredLogger.lifecycle().systemDeployed(result.success(), containersDeployed, layersDeployed, errors.size());
        log.info("{}", result.message());
        return result;
    }

    // ==================== Health ====================

    public SystemHealthReport checkSystemHealth() {
        Map<String, HealthStatus> containers = new LinkedHashMap<>();
        for (ContainerInfo container : containerManager.list()) {
            containers.put(container.name(), containerManager.healthCheck(container.name()));
        }

        Map<String, HealthStatus> layers = layerManager.layerHealth();

        Map<String, HealthStatus> services = new LinkedHashMap<>();
        for (String service : expectedServices) {
            services.put(service, host.isServiceActive(service) ? HealthStatus.HEALTHY : HealthStatus.UNHEALTHY);
        }

        List<HealthStatus> all = new ArrayList<>(containers.values());
        all.addAll(layers.values());
        all.addAll(services.values());
        HealthStatus overall = HealthStatus.reduce(all);

        SystemHealthReport report = new SystemHealthReport(overall, containers, layers, services, Instant.now());
        SystemHealthReport previous = lastHealth.getAndSet(report);
        if (previous.overall() != overall) {
            structuredLogger.lifecycle().healthChanged(previous.overall().name(), overall.name());
        }
        metricsRegistry.setHealthStatus(overall.gaugeValue());
        return report;
    }

    @Scheduled(fixedRateString = "${reconciler.health.check-interval-ms:30000}",
               initialDelayString = "${reconciler.health.initial-delay-ms:30000}")
    public void scheduledHealthCheck() {
        log.debug("Performing scheduled health check");
        try {
            checkSystemHealth();
        } catch (ReconcilerException e) {
            log.warn("Scheduled health check failed: {}", e.getMessage());
        }
    }

    /**
     * Most recent health report, without running a new check.
     */
    public SystemHealthReport lastHealthReport() {
        return lastHealth.get();
    }

    // ==================== Updates ====================

    /**
     * Reconcile the host from the last applied configuration to {@code desired}.
     */
    public LiveUpdateResult applyUpdate(SystemConfiguration desired, LiveUpdateOptions options) {
        return liveUpdateManager.applyLiveUpdates(currentConfiguration(), desired, options);
    }

    /**
     * Last applied configuration, or the empty configuration when nothing has been applied.
     */
    public SystemConfiguration currentConfiguration() {
        return stateSync.currentConfiguration().orElseGet(SystemConfiguration::empty);
    }

    // ==================== Start / Stop ====================

    public SystemActionResult startSystem() {
        List<String> started = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        for (LayerInfo layer : layerManager.listLayers()) {
            if (layer.type() != LayerType.SYSTEM
                    || (layer.status() != LayerStatus.DEPLOYED && layer.status() != LayerStatus.STOPPED)) {
                continue;
            }
            try {
                layerManager.startLayer(layer.name());
                started.add(layer.name());
            } catch (ReconcilerException e) {
                log.error("Failed to start layer {}: {}", layer.name(), e.getMessage());
                errors.add(layer.name() + ": " + e.getMessage());
            }
        }

        log.info("System start: {} layers started, {} failed", started.size(), errors.size());
        return SystemActionResult.of(started, errors);
    }

    public SystemActionResult stopSystem() {
        List<String> stopped = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        for (LayerInfo layer : layerManager.listLayers()) {
            if (layer.status() != LayerStatus.RUNNING) {
                continue;
            }
            try {
                layerManager.stopLayer(layer.name());
                stopped.add(layer.name());
            } catch (ReconcilerException e) {
                log.error("Failed to stop layer {}: {}", layer.name(), e.getMessage());
                errors.add(layer.name() + ": " + e.getMessage());
            }
        }

        log.info("System stop: {} layers stopped, {} failed", stopped.size(), errors.size());
        return SystemActionResult.of(stopped, errors);
    }

    /**
     * Remove every container and forget the persisted system state.
     */
    public int cleanupSystem() {
        int removed = containerManager.cleanup();
        stateStore.delete();
        log.info("System cleanup removed {} containers", removed);
        return removed;
    }

    public String containerLogs(String name, int tail) {
        return containerManager.logs(name, tail);
    }

    // ==================== State ====================

    public SystemStateRecord currentState() {
        return new SystemStateRecord(
            SystemStateRecord.CURRENT_VERSION,
            Instant.now(),
            containerManager.list(),
            layerManager.listLayers(),
            reproducible,
            lastHealth.get().overall());
    }

    public String exportState() {
        return stateStore.toJson(currentState());
    }

    /**
     * Replace the persisted system state record. Nothing is deployed.
     */
    public SystemStateRecord importState(String json) {
        SystemStateRecord record = stateStore.fromJson(json);
        stateStore.save(record);
        reproducible = record.reproducible();
        log.info("Imported system state {} with {} containers and {} layers",
            record.version(), record.containers().size(), record.layers().size());
        return record;
    }

    /**
     * Load the persisted record on startup, if there is one.
     */
    public boolean loadPersistedState() {
        boolean found = stateStore.load()
            .map(record -> {
                reproducible = record.reproducible();
                return true;
            })
            .orElse(false);
        structuredLogger.lifecycle().stateLoaded(stateStore.path().toString(), found);
        return found;
    }
}
