package com.platform.reconciler.container;

import com.platform.reconciler.core.CircuitBreakerManager;
import com.platform.reconciler.error.ContainerOperationException;
import com.platform.reconciler.error.ResourceConflictException;
import com.platform.reconciler.error.ResourceNotFoundException;
import com.platform.reconciler.host.CommandResult;
import com.platform.reconciler.model.ContainerRuntime;
import com.platform.reconciler.model.ContainerSpec;
import com.platform.reconciler.model.ContainersConfig;
import com.platform.reconciler.observability.MetricsRegistry;
import com.platform.reconciler.observability.StructuredLogger;
import com.platform.reconciler.support.FakeCommandRunner;
import com.platform.reconciler.support.TestFixtures;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContainerManagerTest {

    @TempDir
    Path exportDir;

    private FakeCommandRunner runner;
    private CircuitBreakerRegistry breakerRegistry;
    private ContainerManager manager;

    @BeforeEach
    void setUp() {
        runner = new FakeCommandRunner().succeed("podman create", "abc123\n");
        breakerRegistry = CircuitBreakerRegistry.ofDefaults();
        MetricsRegistry metrics = TestFixtures.metrics();
        CircuitBreakerManager breakers = new CircuitBreakerManager(breakerRegistry, metrics);
        breakers.init();
        manager = new ContainerManager(runner, breakers, TestFixtures.objectMapper(), metrics, new StructuredLogger(),
            Duration.ofSeconds(5), Duration.ofSeconds(5), exportDir, ContainerRuntime.PODMAN);
    }

    private static ContainerSpec devSpec() {
        return ContainerSpec.builder()
            .name("dev")
            .image("archlinux")
            .environment(Map.of("EDITOR", "vim"))
            .persistent(List.of("/home:/home"))
            .packages(List.of("git", "make"))
            .build();
    }

    @Test
    void createRunsCreateThenInstallsPackages() {
        ContainerInfo info = manager.create(devSpec(), List.of("/tmp:/tmp"));

        assertThat(info.id()).isEqualTo("abc123");
        assertThat(info.status()).isEqualTo(ContainerStatus.CREATED);
        assertThat(info.mounts()).containsExactly("/tmp:/tmp", "/home:/home");
        assertThat(runner.invocations().get(0)).containsExactly(
            "podman", "create", "--name", "dev",
            "--env", "EDITOR=vim",
            "--volume", "/tmp:/tmp", "--volume", "/home:/home",
            "archlinux:latest");
        assertThat(runner.invocations().get(1)).containsExactly(
            "podman", "exec", "dev", "sh", "-c", "pacman -S --noconfirm git make");
    }

    @Test
    void duplicateNameIsRejected() {
        manager.create(devSpec());

        assertThatThrownBy(() -> manager.create(devSpec()))
            .isInstanceOf(ResourceConflictException.class);
    }

    @Test
    void failedSetupStepMarksContainerAsError() {
        runner.fail("podman exec dev sh -c pacman");

        assertThatThrownBy(() -> manager.create(devSpec()))
            .isInstanceOfSatisfying(ContainerOperationException.class,
                e -> assertThat(e.getStep()).isEqualTo("install-packages"));
        assertThat(manager.get("dev")).get()
            .extracting(ContainerInfo::status)
            .isEqualTo(ContainerStatus.ERROR);
    }

    @Test
    void statusComesFromInspect() {
        manager.create(devSpec());
        runner.succeed("podman inspect", "running\n");

        assertThat(manager.status("dev")).isEqualTo(ContainerStatus.RUNNING);
        assertThat(manager.healthCheck("dev")).isEqualTo(HealthStatus.HEALTHY);
    }

    @Test
    void failingInspectReportsError() {
        manager.create(devSpec());
        runner.fail("podman inspect");

        assertThat(manager.status("dev")).isEqualTo(ContainerStatus.ERROR);
        assertThat(manager.healthCheck("dev")).isEqualTo(HealthStatus.UNHEALTHY);
    }

    @Test
    void exportedShimsAreRemovedWithTheContainer() {
        ContainerSpec spec = devSpec().toBuilder().binaries(List.of("gcc")).build();
        manager.create(spec);

        List<Path> shims = manager.exportBinaries(spec);
        assertThat(shims).containsExactly(exportDir.resolve("gcc"));
        assertThat(exportDir.resolve("gcc")).content().contains("exec podman exec dev gcc");

        manager.remove("dev", true);

        assertThat(Files.exists(exportDir.resolve("gcc"))).isFalse();
        assertThat(manager.get("dev")).isEmpty();
        assertThat(runner.joinedInvocations()).contains("podman rm -f dev");
    }

    @Test
    void binaryNameCannotLeaveTheExportDirectory() {
        ContainerSpec spec = devSpec().toBuilder().binaries(List.of("../escape")).build();
        manager.create(spec);

        assertThatThrownBy(() -> manager.exportBinaries(spec))
            .isInstanceOfSatisfying(ContainerOperationException.class,
                e -> assertThat(e.getStep()).isEqualTo("export-binaries"));
        assertThat(Files.exists(exportDir.resolveSibling("escape"))).isFalse();
    }

    @Test
    void binaryExportedByAnotherContainerIsRefusedAndKept() {
        ContainerSpec dev = devSpec().toBuilder().binaries(List.of("gcc")).build();
        ContainerSpec tools = ContainerSpec.builder().name("tools").image("fedora").binaries(List.of("gcc")).build();
        manager.create(dev);
        manager.create(tools);
        manager.exportBinaries(dev);

        assertThatThrownBy(() -> manager.exportBinaries(tools))
            .isInstanceOf(ResourceConflictException.class)
            .hasMessageContaining("gcc")
            .hasMessageContaining("dev");

        manager.remove("tools", true);
        assertThat(exportDir.resolve("gcc")).content().contains("exec podman exec dev gcc");

        manager.remove("dev", true);
        assertThat(Files.exists(exportDir.resolve("gcc"))).isFalse();
    }

    @Test
    void statsParsesPodmanOutput() {
        manager.create(devSpec());
        runner.succeed("podman stats",
            "[{\"cpu_percent\":\"12.5%\",\"mem_percent\":\"3.25%\",\"mem_usage\":\"100MB / 2GB\",\"pids\":\"7\"}]");

        ContainerStats stats = manager.stats("dev");

        assertThat(stats.cpuPercent()).isEqualTo(12.5);
        assertThat(stats.memoryPercent()).isEqualTo(3.25);
        assertThat(stats.pids()).isEqualTo("7");
    }

    @Test
    void deployContainersSkipsFailuresAndStartsAutoStart() {
        runner.respond("podman create --name broken", CommandResult.failure(125, "image not found"));
        ContainersConfig config = ContainersConfig.builder()
            .containers(List.of(
                devSpec().toBuilder().autoStart(true).build(),
                ContainerSpec.builder().name("broken").image("missing").build()))
            .build();

        List<ContainerInfo> deployed = manager.deployContainers(config);

        assertThat(deployed).extracting(ContainerInfo::name).containsExactly("dev");
        assertThat(deployed.get(0).status()).isEqualTo(ContainerStatus.RUNNING);
        assertThat(runner.joinedInvocations()).contains("podman start dev");
    }

    @Test
    void openBreakerShortCircuitsRuntimeCalls() {
        manager.create(devSpec());
        breakerRegistry.circuitBreaker("runtime-podman").transitionToOpenState();
        runner.clearInvocations();

        assertThatThrownBy(() -> manager.start("dev"))
            .isInstanceOfSatisfying(ContainerOperationException.class,
                e -> assertThat(e.getStep()).isEqualTo("runtime"));
        assertThat(runner.invocations()).isEmpty();
    }

    @Test
    void unknownContainerIsNotFound() {
        assertThatThrownBy(() -> manager.logs("ghost", 10))
            .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void cleanupRemovesEverything() {
        manager.create(devSpec());
        manager.create(ContainerSpec.builder().name("tools").image("fedora").build());

        assertThat(manager.cleanup()).isEqualTo(2);
        assertThat(manager.list()).isEmpty();
    }
}
