package com.platform.reconciler.update;

import com.platform.reconciler.change.ChangeDetector;
import com.platform.reconciler.change.ChangeType;
import com.platform.reconciler.change.ConfigChange;
import com.platform.reconciler.change.UpdateClassifier;
import com.platform.reconciler.error.CommandTimeoutException;
import com.platform.reconciler.error.ResourceConflictException;
import com.platform.reconciler.error.RollbackFailedException;
import com.platform.reconciler.host.CommandResult;
import com.platform.reconciler.host.HostOperations;
import com.platform.reconciler.host.ServiceReloader;
import com.platform.reconciler.model.PackageSpec;
import com.platform.reconciler.model.ServiceSpec;
import com.platform.reconciler.model.SystemConfiguration;
import com.platform.reconciler.model.SystemSettings;
import com.platform.reconciler.model.UserSpec;
import com.platform.reconciler.notify.UpdateEvent;
import com.platform.reconciler.notify.UpdateEventType;
import com.platform.reconciler.notify.UpdateNotifier;
import com.platform.reconciler.observability.StructuredLogger;
import com.platform.reconciler.snapshot.StateSyncManager;
import com.platform.reconciler.support.FakeCommandRunner;
import com.platform.reconciler.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verifyNoInteractions;

class LiveUpdateManagerTest {

    @TempDir
    Path root;

    private FakeCommandRunner runner;
    private StateSyncManager stateSync;
    private UpdateNotifier notifier;
    private UpdatePhaseMachine phases;

    private final SystemConfiguration current = SystemConfiguration.builder()
        .system(new SystemSettings("alpha", "UTC", "en_US.UTF-8"))
        .packages(List.of(PackageSpec.install("vim")))
        .users(List.of(UserSpec.builder().name("alice").build()))
        .build();

    private final SystemConfiguration desired = current.toBuilder()
        .system(new SystemSettings("beta", "UTC", "en_US.UTF-8"))
        .packages(List.of(PackageSpec.install("vim"), PackageSpec.install("git")))
        .services(List.of(ServiceSpec.enabled("sshd")))
        .build();

    @BeforeEach
    void setUp() {
        runner = new FakeCommandRunner();
        HostOperations host = TestFixtures.host(runner, root);
        stateSync = new StateSyncManager(TestFixtures.objectMapper(), host, root.resolve("state"), 10);
        notifier = new UpdateNotifier(List.of(), 100);
        phases = new UpdatePhaseMachine(TestFixtures.metrics());
    }

    private LiveUpdateManager manager(ChangeApplier applier) {
        return new LiveUpdateManager(
            new ChangeDetector(TestFixtures.policy()),
            new UpdateClassifier(TestFixtures.policy()),
            applier,
            stateSync,
            notifier,
            phases,
            TestFixtures.metrics(),
            new StructuredLogger());
    }

    private LiveUpdateManager manager() {
        HostOperations host = TestFixtures.host(runner, root);
        return manager(new ChangeApplier(host, new ServiceReloader(runner, host, Duration.ofSeconds(5))));
    }

    private static LiveUpdateOptions options(boolean continueOnError) {
        return LiveUpdateOptions.builder().continueOnError(continueOnError).build();
    }

    @Test
    void unchangedConfigurationNeedsNothing() {
        LiveUpdateManager manager = manager();

        LiveUpdateResult result = manager.applyLiveUpdates(current, current, LiveUpdateOptions.defaults());

        assertThat(result).isInstanceOf(LiveUpdateResult.NoChangesRequired.class);
        assertThat(runner.invocations()).isEmpty();
        assertThat(manager.currentPhase()).isEqualTo(UpdatePhase.IDLE);
        assertThat(manager.lastRun()).get()
            .extracting(UpdateRunSummary::finalPhase)
            .isEqualTo(UpdatePhase.COMMITTED);
    }

    @Test
    void successfulRunAppliesInDetectionOrderAndRecordsState() {
        LiveUpdateManager manager = manager();

        LiveUpdateResult result = manager.applyLiveUpdates(current, desired, LiveUpdateOptions.defaults());

        assertThat(result).isInstanceOfSatisfying(LiveUpdateResult.Success.class, success -> {
            assertThat(success.applied()).extracting(ConfigChange::type).containsExactly(
                ChangeType.SYSTEM_CONFIG, ChangeType.PACKAGE_INSTALL, ChangeType.SERVICE_ADD);
            assertThat(success.pendingReboot()).isEmpty();
        });
        assertThat(runner.joinedInvocations()).contains(
            "hostnamectl set-hostname beta",
            "pacman -S --noconfirm --needed git",
            "systemctl enable --now sshd");
        assertThat(stateSync.currentConfiguration()).contains(desired);
        assertThat(manager.lastRun()).get().extracting(UpdateRunSummary::snapshotId).isNotNull();
    }

    @Test
    void secondRunAgainstRecordedStateIsANoOp() {
        LiveUpdateManager manager = manager();
        manager.applyLiveUpdates(current, desired, LiveUpdateOptions.defaults());

        SystemConfiguration recorded = stateSync.currentConfiguration().orElseThrow();
        LiveUpdateResult second = manager.applyLiveUpdates(recorded, desired, LiveUpdateOptions.defaults());

        assertThat(second).isInstanceOf(LiveUpdateResult.NoChangesRequired.class);
    }

    @Nested
    class RebootGate {

        private final SystemConfiguration withoutAlice = desired.toBuilder().users(List.of()).build();

        @Test
        void refusesBeforeTouchingAnything() {
            ChangeApplier applier = mock(ChangeApplier.class);
            LiveUpdateManager manager = manager(applier);

            LiveUpdateResult result = manager.applyLiveUpdates(current, withoutAlice,
                LiveUpdateOptions.builder().allowPartialUpdate(false).build());

            assertThat(result).isInstanceOfSatisfying(LiveUpdateResult.RebootRequired.class,
                blocked -> assertThat(blocked.changes()).extracting(ConfigChange::type)
                    .containsExactly(ChangeType.USER_REMOVE));
            verifyNoInteractions(applier);
            assertThat(stateSync.listSnapshots()).isEmpty();
            assertThat(manager.lastRun()).get()
                .extracting(UpdateRunSummary::finalPhase)
                .isEqualTo(UpdatePhase.REBOOT_BLOCKED);
        }

        @Test
        void partialUpdateAppliesTheRestAndReportsPending() {
            LiveUpdateResult result = manager().applyLiveUpdates(current, withoutAlice, LiveUpdateOptions.defaults());

            assertThat(result).isInstanceOfSatisfying(LiveUpdateResult.Success.class, success -> {
                assertThat(success.applied()).hasSize(3);
                assertThat(success.pendingReboot()).extracting(ConfigChange::type)
                    .containsExactly(ChangeType.USER_REMOVE);
            });
            assertThat(runner.count("userdel")).isZero();
        }
    }

    @Test
    void failedChangeWithContinueOnErrorIsPartialSuccess() {
        runner.fail("pacman -S");

        LiveUpdateResult result = manager().applyLiveUpdates(current, desired, options(true));

        assertThat(result).isInstanceOfSatisfying(LiveUpdateResult.PartialSuccess.class, partial -> {
            assertThat(partial.applied()).extracting(ConfigChange::type)
                .containsExactly(ChangeType.SYSTEM_CONFIG, ChangeType.SERVICE_ADD);
            assertThat(partial.failed()).singleElement().satisfies(failed -> {
                assertThat(failed.change().type()).isEqualTo(ChangeType.PACKAGE_INSTALL);
                assertThat(failed.errorCode()).isEqualTo("CP-440");
            });
        });
    }

    @Test
    void abortRestoresTheSnapshotByteForByte() throws Exception {
        stateSync.syncState(current);
        byte[] before = Files.readAllBytes(stateSync.currentConfigPath());
        runner.fail("pacman -S");

        LiveUpdateResult result = manager().applyLiveUpdates(current, desired, options(false));

        assertThat(result).isInstanceOfSatisfying(LiveUpdateResult.Failed.class, failed -> {
            assertThat(failed.rolledBack()).isTrue();
            assertThat(failed.errorCode()).isEqualTo("CP-601");
            assertThat(failed.failed()).extracting(f -> f.change().type())
                .containsExactly(ChangeType.PACKAGE_INSTALL);
        });
        assertThat(Files.readAllBytes(stateSync.currentConfigPath())).isEqualTo(before);
        assertThat(notifier.history(100)).extracting(UpdateEvent::type)
            .contains(UpdateEventType.ROLLBACK_STARTED, UpdateEventType.ROLLBACK_COMPLETED, UpdateEventType.UPDATE_FAILED);
    }

    @Test
    void abortWithoutRollbackLeavesStateAlone() {
        runner.fail("pacman -S");

        LiveUpdateResult result = manager().applyLiveUpdates(current, desired,
            LiveUpdateOptions.builder().continueOnError(false).rollbackOnFailure(false).build());

        assertThat(result).isInstanceOfSatisfying(LiveUpdateResult.Failed.class,
            failed -> assertThat(failed.rolledBack()).isFalse());
        assertThat(stateSync.currentConfiguration()).isEmpty();
    }

    @Test
    void failedRollbackIsEscalated() {
        runner.succeed("hostname", "alpha");
        runner.respond("pacman -S", command -> {
            // The host drifts and can no longer be restored
            runner.succeed("hostname", "beta");
            runner.fail("hostnamectl");
            return CommandResult.failure(1, "mirror unreachable");
        });
        SystemConfiguration packagesOnly = current.toBuilder()
            .packages(List.of(PackageSpec.install("vim"), PackageSpec.install("git")))
            .build();
        LiveUpdateManager manager = manager();

        assertThatThrownBy(() -> manager.applyLiveUpdates(current, packagesOnly, options(false)))
            .isInstanceOfSatisfying(RollbackFailedException.class, e -> {
                assertThat(e.getSnapshotId()).isEqualTo(manager.lastRun().orElseThrow().snapshotId());
                assertThat(e.getSuppressed()).hasSize(1);
            });
        assertThat(manager.currentPhase()).isEqualTo(UpdatePhase.IDLE);
        assertThat(manager.isRunning()).isFalse();
        assertThat(manager.lastRun()).get().extracting(UpdateRunSummary::finalPhase).isEqualTo(UpdatePhase.FAILED);
    }

    @Test
    void dryRunTouchesNothing() {
        LiveUpdateResult result = manager().applyLiveUpdates(current, desired,
            LiveUpdateOptions.builder().dryRun(true).build());

        assertThat(result).isInstanceOf(LiveUpdateResult.Success.class);
        assertThat(runner.invocations()).isEmpty();
        assertThat(stateSync.listSnapshots()).isEmpty();
        assertThat(stateSync.currentConfiguration()).isEmpty();
    }

    @Test
    void liveChangesRunOnWorkerThreads() {
        ChangeApplier applier = mock(ChangeApplier.class);
        Map<ChangeType, String> threads = new ConcurrentHashMap<>();
        doAnswer(invocation -> {
            ConfigChange change = invocation.getArgument(0);
            threads.put(change.type(), Thread.currentThread().getName());
            return null;
        }).when(applier).applyLive(any(), anyBoolean());

        LiveUpdateResult result = manager(applier).applyLiveUpdates(current, desired, LiveUpdateOptions.defaults());

        assertThat(result).isInstanceOf(LiveUpdateResult.Success.class);
        assertThat(threads).containsOnlyKeys(ChangeType.SYSTEM_CONFIG, ChangeType.PACKAGE_INSTALL);
        assertThat(threads.values()).allMatch(name -> name.startsWith("live-update-"));
    }

    @Test
    void changesOnTheSameResourceNeverOverlap() {
        ChangeApplier applier = mock(ChangeApplier.class);
        Map<String, AtomicInteger> active = new ConcurrentHashMap<>();
        Map<String, Integer> peak = new ConcurrentHashMap<>();
        List<ChangeType> packageOrder = new CopyOnWriteArrayList<>();
        doAnswer(invocation -> {
            ConfigChange change = invocation.getArgument(0);
            String key = change.resourceKey();
            int running = active.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();
            peak.merge(key, running, Math::max);
            if (key.equals("package-manager")) {
                packageOrder.add(change.type());
            }
            Thread.sleep(50);
            active.get(key).decrementAndGet();
            return null;
        }).when(applier).applyLive(any(), anyBoolean());
        SystemConfiguration swapped = current.toBuilder()
            .system(new SystemSettings("beta", "Europe/Berlin", "en_US.UTF-8"))
            .packages(List.of(PackageSpec.install("git")))
            .build();

        LiveUpdateResult result = manager(applier).applyLiveUpdates(current, swapped, LiveUpdateOptions.defaults());

        assertThat(result).isInstanceOf(LiveUpdateResult.Success.class);
        assertThat(packageOrder).containsExactly(ChangeType.PACKAGE_INSTALL, ChangeType.PACKAGE_REMOVE);
        assertThat(peak).containsEntry("package-manager", 1).containsEntry("system:hostname", 1);
    }

    @Test
    void parallelGroupsAreBoundedByMaxParallelOperations() {
        ChangeApplier applier = mock(ChangeApplier.class);
        AtomicInteger active = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        CountDownLatch firstTwo = new CountDownLatch(2);
        AtomicBoolean overlapped = new AtomicBoolean();
        doAnswer(invocation -> {
            peak.accumulateAndGet(active.incrementAndGet(), Math::max);
            firstTwo.countDown();
            if (firstTwo.await(2, TimeUnit.SECONDS) && active.get() > 1) {
                overlapped.set(true);
            }
            Thread.sleep(30);
            active.decrementAndGet();
            return null;
        }).when(applier).applyLive(any(), anyBoolean());
        SystemConfiguration fourGroups = current.toBuilder()
            .system(new SystemSettings("beta", "Europe/Berlin", "de_DE.UTF-8"))
            .packages(List.of(PackageSpec.install("vim"), PackageSpec.install("git")))
            .build();

        LiveUpdateResult result = manager(applier).applyLiveUpdates(current, fourGroups,
            LiveUpdateOptions.builder().maxParallelOperations(2).build());

        assertThat(result).isInstanceOfSatisfying(LiveUpdateResult.Success.class,
            success -> assertThat(success.applied()).hasSize(4));
        assertThat(peak.get()).isEqualTo(2);
        assertThat(overlapped).isTrue();
    }

    @Test
    void timedOutCommandBecomesAFailedChange() {
        runner.respond("pacman -S", command -> {
            throw new CommandTimeoutException(command, Duration.ofSeconds(5));
        });

        LiveUpdateResult result = manager().applyLiveUpdates(current, desired, options(true));

        assertThat(result).isInstanceOfSatisfying(LiveUpdateResult.PartialSuccess.class, partial -> {
            assertThat(partial.applied()).extracting(ConfigChange::type)
                .containsExactly(ChangeType.SYSTEM_CONFIG, ChangeType.SERVICE_ADD);
            assertThat(partial.failed()).singleElement().satisfies(failed -> {
                assertThat(failed.change().type()).isEqualTo(ChangeType.PACKAGE_INSTALL);
                assertThat(failed.errorCode()).isEqualTo("CP-441");
                assertThat(failed.error()).contains("timed out");
            });
        });
        assertThat(runner.joinedInvocations()).contains("systemctl enable --now sshd");
    }

    @Test
    void unexpectedErrorWhileApplyingReportsAppliedChangesAndRollsBack() throws Exception {
        stateSync.syncState(current);
        byte[] before = Files.readAllBytes(stateSync.currentConfigPath());
        stateSync = spy(stateSync);
        doThrow(new IllegalStateException("state directory vanished")).when(stateSync).syncState(desired);
        LiveUpdateManager manager = manager();

        LiveUpdateResult result = manager.applyLiveUpdates(current, desired, LiveUpdateOptions.defaults());

        assertThat(result).isInstanceOfSatisfying(LiveUpdateResult.Failed.class, failed -> {
            assertThat(failed.errorCode()).isEqualTo("CP-601");
            assertThat(failed.error()).isEqualTo("state directory vanished");
            assertThat(failed.applied()).extracting(ConfigChange::type).containsExactly(
                ChangeType.SYSTEM_CONFIG, ChangeType.PACKAGE_INSTALL, ChangeType.SERVICE_ADD);
            assertThat(failed.rolledBack()).isTrue();
        });
        assertThat(Files.readAllBytes(stateSync.currentConfigPath())).isEqualTo(before);
        assertThat(manager.lastRun()).get().extracting(UpdateRunSummary::finalPhase).isEqualTo(UpdatePhase.ROLLED_BACK);
    }

    @Test
    void concurrentRunIsRejected() throws Exception {
        ChangeApplier applier = mock(ChangeApplier.class);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        doAnswer(invocation -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return null;
        }).when(applier).applyLive(any(), anyBoolean());
        LiveUpdateManager manager = manager(applier);

        CompletableFuture<LiveUpdateResult> first = CompletableFuture.supplyAsync(
            () -> manager.applyLiveUpdates(current, desired, LiveUpdateOptions.defaults()));
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(manager.isRunning()).isTrue();
        assertThatThrownBy(() -> manager.applyLiveUpdates(current, desired, LiveUpdateOptions.defaults()))
            .isInstanceOf(ResourceConflictException.class);

        release.countDown();
        assertThat(first.get(5, TimeUnit.SECONDS)).isInstanceOf(LiveUpdateResult.Success.class);
    }

    @Test
    void previewEstimatesWithoutApplying() {
        SystemConfiguration bigger = desired.toBuilder()
            .packages(List.of(PackageSpec.install("vim"), PackageSpec.install("git"), PackageSpec.install("htop")))
            .users(List.of())
            .build();
        LiveUpdateManager manager = manager();

        LiveUpdateCapability capability = manager.canApplyLiveUpdates(current, bigger);

        // hostname 2s + two installs 60s + one service 5s
        assertThat(capability.estimatedDuration()).isEqualTo(Duration.ofSeconds(67));
        assertThat(capability.canFullyUpdate()).isFalse();
        assertThat(capability.liveUpdatableChanges()).isEqualTo(3);
        assertThat(capability.rebootRequiredChanges()).isEqualTo(1);
        assertThat(manager.previewChanges(current, bigger)).last()
            .extracting(ConfigChange::type)
            .isEqualTo(ChangeType.USER_REMOVE);
        assertThat(runner.invocations()).isEmpty();
    }
}
