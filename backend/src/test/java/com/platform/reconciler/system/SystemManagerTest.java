package com.platform.reconciler.system;

import com.platform.reconciler.container.ContainerManager;
import com.platform.reconciler.container.HealthStatus;
import com.platform.reconciler.error.CircularDependencyException;
import com.platform.reconciler.error.ValidationException;
import com.platform.reconciler.host.HostOperations;
import com.platform.reconciler.layer.LayerManager;
import com.platform.reconciler.layer.LayerOrderResolver;
import com.platform.reconciler.layer.LayerStatus;
import com.platform.reconciler.model.ContainerSpec;
import com.platform.reconciler.model.ContainersConfig;
import com.platform.reconciler.model.LayerStrategy;
import com.platform.reconciler.model.LayersConfig;
import com.platform.reconciler.model.ReproducibleConfig;
import com.platform.reconciler.model.SystemConfiguration;
import com.platform.reconciler.model.SystemLayer;
import com.platform.reconciler.observability.StructuredLogger;
import com.platform.reconciler.snapshot.StateSyncManager;
import com.platform.reconciler.support.FakeCommandRunner;
import com.platform.reconciler.support.TestFixtures;
import com.platform.reconciler.update.LiveUpdateManager;
import com.platform.reconciler.update.LiveUpdateOptions;
import com.platform.reconciler.update.LiveUpdateResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SystemManagerTest {

    @TempDir
    Path root;

    private FakeCommandRunner runner;
    private ContainerManager containers;
    private LayerManager layers;
    private LiveUpdateManager liveUpdates;
    private StateSyncManager stateSync;
    private SystemStateStore store;
    private SystemManager manager;

    @BeforeEach
    void setUp() {
        runner = new FakeCommandRunner()
            .succeed("systemctl is-active", "active")
            .succeed("podman inspect", "running");
        HostOperations host = TestFixtures.host(runner, root);
        LayerOrderResolver resolver = new LayerOrderResolver();

        containers = TestFixtures.containerManager(runner, root.resolve("bin"));
        layers = new LayerManager(containers, resolver, TestFixtures.metrics(), new StructuredLogger());
        liveUpdates = mock(LiveUpdateManager.class);
        stateSync = new StateSyncManager(TestFixtures.objectMapper(), host, root.resolve("state"), 10);
        store = new SystemStateStore(TestFixtures.objectMapper(), root.resolve("system-state.json"));

        manager = new SystemManager(new ConfigurationValidator(resolver), containers, layers, liveUpdates,
            stateSync, store, host, TestFixtures.metrics(), new StructuredLogger(), List.of("podman.socket"));
    }

    private static SystemLayer layer(String name, LayerStrategy strategy) {
        return SystemLayer.builder()
            .name(name)
            .strategy(strategy)
            .container(ContainerSpec.builder().name(name + "-box").image("archlinux").build())
            .build();
    }

    private static SystemConfiguration fullConfig() {
        return SystemConfiguration.builder()
            .containers(ContainersConfig.builder()
                .containers(List.of(
                    ContainerSpec.builder().name("tools").image("fedora").build(),
                    ContainerSpec.builder().name("broken").image("missing").build()))
                .build())
            .layers(LayersConfig.builder()
                .system(List.of(
                    layer("development", LayerStrategy.ALWAYS_ON),
                    layer("gaming", LayerStrategy.ON_DEMAND)))
                .build())
            .reproducible(new ReproducibleConfig(true, false, true, null, "sha256:abc"))
            .build();
    }

    @Test
    void deploymentCollectsPerItemFailures() {
        runner.fail("podman create --name broken");

        DeploymentResult result = manager.deploySystem(fullConfig());

        assertThat(result.success()).isFalse();
        assertThat(result.containersDeployed()).isEqualTo(1);
        assertThat(result.layersDeployed()).isEqualTo(2);
        assertThat(result.errors()).containsExactly("Container broken failed to deploy");
        assertThat(result.message()).isEqualTo("System deployed with 1 errors");

        SystemStateRecord persisted = store.load().orElseThrow();
        assertThat(persisted.containers()).extracting(c -> c.name())
            .containsExactly("development-box", "gaming-box", "tools");
        assertThat(persisted.reproducible().pinnedBase()).isEqualTo("sha256:abc");
    }

    @Test
    void invalidConfigurationTouchesNothing() {
        SystemConfiguration config = fullConfig().toBuilder()
            .containers(ContainersConfig.builder()
                .containers(List.of(ContainerSpec.builder().name("noimage").build()))
                .build())
            .build();

        assertThatThrownBy(() -> manager.deploySystem(config)).isInstanceOf(ValidationException.class);
        assertThat(runner.invocations()).isEmpty();
        assertThat(store.load()).isEmpty();
    }

    @Test
    void layerContainerSharingATopLevelNameIsRejectedBeforeDeploy() {
        SystemConfiguration config = fullConfig().toBuilder()
            .layers(LayersConfig.builder()
                .system(List.of(SystemLayer.builder()
                    .name("toolbox")
                    .container(ContainerSpec.builder().name("tools").image("archlinux").build())
                    .build()))
                .build())
            .build();

        assertThatThrownBy(() -> manager.deploySystem(config))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("duplicate container name");
        assertThat(runner.invocations()).isEmpty();
        assertThat(containers.get("tools")).isEmpty();
    }

    @Test
    void layerCycleTouchesNothing() {
        SystemConfiguration config = SystemConfiguration.builder()
            .layers(LayersConfig.builder()
                .system(List.of(
                    layer("a", LayerStrategy.ON_DEMAND).toBuilder().dependencies(List.of("b")).build(),
                    layer("b", LayerStrategy.ON_DEMAND).toBuilder().dependencies(List.of("a")).build()))
                .build())
            .build();

        assertThatThrownBy(() -> manager.deploySystem(config)).isInstanceOf(CircularDependencyException.class);
        assertThat(runner.invocations()).isEmpty();
    }

    @Test
    void healthAggregatesContainersLayersAndServices() {
        manager.deploySystem(fullConfig());

        SystemHealthReport healthy = manager.checkSystemHealth();
        assertThat(healthy.overall()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(healthy.services()).containsEntry("podman.socket", HealthStatus.HEALTHY);

        runner.succeed("systemctl is-active podman.socket", "inactive");
        SystemHealthReport degraded = manager.checkSystemHealth();

        assertThat(degraded.overall()).isEqualTo(HealthStatus.UNHEALTHY);
        assertThat(manager.lastHealthReport()).isSameAs(degraded);
    }

    @Test
    void startAndStopToggleEligibleLayers() {
        runner.succeed("podman inspect", "created");
        manager.deploySystem(SystemConfiguration.builder()
            .layers(LayersConfig.builder().system(List.of(layer("gaming", LayerStrategy.ON_DEMAND))).build())
            .build());

        SystemActionResult started = manager.startSystem();
        assertThat(started.success()).isTrue();
        assertThat(started.affectedLayers()).containsExactly("gaming");

        runner.succeed("podman inspect", "running");
        SystemActionResult stopped = manager.stopSystem();
        assertThat(stopped.affectedLayers()).containsExactly("gaming");
        assertThat(runner.joinedInvocations()).contains("podman start gaming-box", "podman stop gaming-box");

        runner.succeed("podman inspect", "exited");
        assertThat(layers.getLayer("gaming").status()).isEqualTo(LayerStatus.STOPPED);
    }

    @Test
    void updatesStartFromTheRecordedConfiguration() {
        SystemConfiguration desired = fullConfig();
        LiveUpdateOptions options = LiveUpdateOptions.defaults();
        when(liveUpdates.applyLiveUpdates(SystemConfiguration.empty(), desired, options))
            .thenReturn(LiveUpdateResult.NoChangesRequired.INSTANCE);

        assertThat(manager.applyUpdate(desired, options)).isEqualTo(LiveUpdateResult.NoChangesRequired.INSTANCE);

        stateSync.syncState(desired);
        manager.applyUpdate(desired, options);
        verify(liveUpdates).applyLiveUpdates(eq(desired), eq(desired), eq(options));
    }

    @Test
    void exportedStateCanBeImported() {
        manager.deploySystem(fullConfig().toBuilder().layers(null).build());
        String exported = manager.exportState();
        manager.cleanupSystem();
        assertThat(store.load()).isEmpty();

        SystemStateRecord imported = manager.importState(exported);

        assertThat(imported.containers()).extracting(c -> c.name()).containsExactly("broken", "tools");
        assertThat(manager.loadPersistedState()).isTrue();
    }

    @Test
    void importRejectsGarbage() {
        assertThatThrownBy(() -> manager.importState("{not json"))
            .isInstanceOf(ValidationException.class);
        assertThat(manager.loadPersistedState()).isFalse();
    }
}
