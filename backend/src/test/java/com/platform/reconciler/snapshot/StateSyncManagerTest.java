package com.platform.reconciler.snapshot;

import com.platform.reconciler.error.ResourceNotFoundException;
import com.platform.reconciler.error.StateSyncException;
import com.platform.reconciler.model.PackageSpec;
import com.platform.reconciler.model.ServiceSpec;
import com.platform.reconciler.model.SystemConfiguration;
import com.platform.reconciler.model.SystemSettings;
import com.platform.reconciler.support.FakeCommandRunner;
import com.platform.reconciler.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StateSyncManagerTest {

    @TempDir
    Path stateDir;

    private FakeCommandRunner runner;
    private StateSyncManager manager;

    private final SystemConfiguration first = SystemConfiguration.builder()
        .system(new SystemSettings("alpha", "UTC", "en_US.UTF-8"))
        .packages(List.of(PackageSpec.install("vim")))
        .services(List.of(ServiceSpec.enabled("sshd")))
        .build();

    private final SystemConfiguration second = first.toBuilder()
        .system(new SystemSettings("beta", "UTC", "en_US.UTF-8"))
        .packages(List.of(PackageSpec.install("vim"), PackageSpec.install("git")))
        .build();

    @BeforeEach
    void setUp() {
        runner = new FakeCommandRunner();
        manager = new StateSyncManager(TestFixtures.objectMapper(), TestFixtures.host(runner, stateDir), stateDir, 3);
    }

    @Test
    void nothingAppliedYetMeansNoCurrentConfiguration() {
        assertThat(manager.currentConfiguration()).isEmpty();
        assertThat(manager.exportCurrentConfiguration()).isNull();
    }

    @Test
    void syncedConfigurationBecomesCurrent() {
        manager.syncState(first);

        assertThat(manager.currentConfiguration()).contains(first);
        assertThat(manager.getCurrentState())
            .containsEntry("hostname", "alpha")
            .containsEntry("packages", List.of("vim"));
    }

    @Test
    void restoreWritesBackTheExactBytes() throws Exception {
        manager.syncState(first);
        byte[] before = Files.readAllBytes(manager.currentConfigPath());

        StateSnapshot snapshot = manager.createSnapshot();
        manager.syncState(second);
        assertThat(Files.readAllBytes(manager.currentConfigPath())).isNotEqualTo(before);

        manager.restoreSnapshot(snapshot.id());

        assertThat(Files.readAllBytes(manager.currentConfigPath())).isEqualTo(before);
    }

    @Test
    void snapshotOfEmptyStateClearsRecordOnRestore() {
        StateSnapshot snapshot = manager.createSnapshot();
        assertThat(snapshot.hasConfig()).isFalse();

        manager.syncState(first);
        manager.restoreSnapshot(snapshot);

        assertThat(manager.currentConfiguration()).isEmpty();
    }

    @Test
    void restoreReappliesDriftedHostSettings() {
        runner.succeed("hostname", "alpha");
        manager.syncState(first);
        StateSnapshot snapshot = manager.createSnapshot();

        runner.succeed("hostname", "beta");
        manager.restoreSnapshot(snapshot);

        assertThat(runner.joinedInvocations()).contains("hostnamectl set-hostname alpha");
        assertThat(runner.count("timedatectl set-timezone")).isZero();
    }

    @Test
    void failedHostRestoreIsReported() {
        runner.succeed("hostname", "alpha");
        StateSnapshot snapshot = manager.createSnapshot();
        runner.succeed("hostname", "beta");
        runner.fail("hostnamectl");

        assertThatThrownBy(() -> manager.restoreSnapshot(snapshot)).isInstanceOf(StateSyncException.class);
    }

    @Test
    void unknownSnapshotIsNotFound() {
        assertThatThrownBy(() -> manager.loadSnapshot("snapshot-missing"))
            .isInstanceOf(ResourceNotFoundException.class);
        assertThatThrownBy(() -> manager.loadSnapshot("../etc"))
            .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void cleanupKeepsTheNewest() {
        for (int i = 0; i < 5; i++) {
            manager.createSnapshot();
        }
        List<SnapshotInfo> before = manager.listSnapshots();
        assertThat(before).hasSize(5);

        assertThat(manager.cleanupSnapshots()).isEqualTo(2);

        assertThat(manager.listSnapshots()).extracting(SnapshotInfo::id)
            .containsExactlyElementsOf(before.subList(0, 3).stream().map(SnapshotInfo::id).toList());
    }

    @Test
    void checkSyncReportsEachDrift() {
        runner.succeed("hostname", "other");
        runner.succeed("systemctl is-enabled sshd", "disabled");
        runner.succeed("pacman -Qq", "bash\n");

        SyncStatus status = manager.checkSync(first);

        assertThat(status.isInSync()).isFalse();
        assertThat(status.issues()).extracting(SyncIssue::component)
            .containsExactly("system", "service", "package");
    }
}
