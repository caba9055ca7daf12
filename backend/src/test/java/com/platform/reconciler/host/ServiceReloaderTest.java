package com.platform.reconciler.host;

import com.platform.reconciler.support.FakeCommandRunner;
import com.platform.reconciler.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ServiceReloaderTest {

    @TempDir
    Path root;

    private FakeCommandRunner runner;
    private ServiceReloader reloader;

    @BeforeEach
    void setUp() {
        runner = new FakeCommandRunner().succeed("systemctl is-active", "active");
        reloader = new ServiceReloader(runner, TestFixtures.host(runner, root), Duration.ofSeconds(5));
    }

    @Test
    void signalStrategySendsSignalToMainProcess() {
        ReloadResult result = reloader.reload("nginx");

        assertThat(result.method()).isEqualTo(ReloadMethod.SIGNAL);
        assertThat(runner.joinedInvocations()).contains("systemctl kill --kill-who=main -s HUP nginx");
    }

    @Test
    void commandStrategyRunsTheServiceTool() {
        reloader.reload("postfix");

        assertThat(runner.joinedInvocations()).contains("postfix reload");
    }

    @Test
    void inactiveServiceIsStarted() {
        runner.succeed("systemctl is-active cups", "inactive");

        ReloadResult result = reloader.reload("cups");

        assertThat(result.wasRunning()).isFalse();
        assertThat(result.method()).isEqualTo(ReloadMethod.START);
        assertThat(runner.joinedInvocations()).contains("systemctl start cups");
    }

    @Test
    void unknownServiceFallsBackToSystemdReloadWhenSupported() {
        runner.succeed("systemctl show -p CanReload myapp", "CanReload=yes");

        reloader.reload("myapp");

        assertThat(runner.joinedInvocations()).contains("systemctl reload myapp");
        assertThat(reloader.lastResult("myapp").method()).isEqualTo(ReloadMethod.SYSTEMD);
    }

    @Test
    void unknownServiceWithoutReloadIsRestarted() {
        reloader.reload("legacyd");

        assertThat(runner.joinedInvocations()).contains("systemctl restart legacyd");
    }
}
