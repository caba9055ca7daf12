package com.platform.reconciler.update;

import com.platform.reconciler.change.CategorizedChanges;
import com.platform.reconciler.change.ChangeDetector;
import com.platform.reconciler.change.ChangeType;
import com.platform.reconciler.change.ConfigChange;
import com.platform.reconciler.change.UpdateClassifier;
import com.platform.reconciler.error.ErrorCode;
import com.platform.reconciler.error.LiveUpdateException;
import com.platform.reconciler.error.ReconcilerException;
import com.platform.reconciler.error.ResourceConflictException;
import com.platform.reconciler.error.RollbackFailedException;
import com.platform.reconciler.model.SystemConfiguration;
import com.platform.reconciler.notify.UpdateNotifier;
import com.platform.reconciler.observability.LogEventType;
import com.platform.reconciler.observability.LoggingConfig;
import com.platform.reconciler.observability.MetricsRegistry;
import com.platform.reconciler.observability.StructuredLogger;
import com.platform.reconciler.snapshot.StateSnapshot;
import com.platform.reconciler.snapshot.StateSyncManager;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Converges the running host from one configuration to another without a reboot.
 *
 * <p>Protocol per run: detect and classify; refuse before touching anything when reboot-only changes
 * exist and partial updates are not allowed; snapshot; apply live changes (grouped by resource, groups
 * in parallel) and then service reloads (sequential); on abort restore the snapshot; on completion
 * record the desired configuration as the new current state.
 *
 * <p>Only one run executes at a time.
 */
@Slf4j
@Service
public class LiveUpdateManager {

    private final ChangeDetector changeDetector;
    private final UpdateClassifier classifier;
    private final ChangeApplier applier;
    private final StateSyncManager stateSync;
    private final UpdateNotifier notifier;
    private final UpdatePhaseMachine phases;
    private final MetricsRegistry metricsRegistry;
    private final StructuredLogger structuredLogger;

    private final ReentrantLock runLock = new ReentrantLock();
    private volatile UpdateRunSummary lastRun;

    public LiveUpdateManager(
            ChangeDetector changeDetector,
            UpdateClassifier classifier,
            ChangeApplier applier,
            StateSyncManager stateSync,
            UpdateNotifier notifier,
            UpdatePhaseMachine phases,
            MetricsRegistry metricsRegistry,
            StructuredLogger structuredLogger) {
        this.changeDetector = changeDetector;
        this.classifier = classifier;
        this.applier = applier;
        this.stateSync = stateSync;
        this.notifier = notifier;
        this.phases = phases;
        this.metricsRegistry = metricsRegistry;
        this.structuredLogger = structuredLogger;
    }

    // ==================== Apply ====================

    /**
     * Run one reconciliation pass.
     *
     * @throws ResourceConflictException if another run is in progress
     * @throws RollbackFailedException if the run aborted and the snapshot could not be restored
     */
    public LiveUpdateResult applyLiveUpdates(SystemConfiguration current, SystemConfiguration desired,
                                             LiveUpdateOptions options) {
        if (!runLock.tryLock()) {
            throw ResourceConflictException.updateInProgress();
        }

        String updateId = UUID.randomUUID().toString();
        Instant startedAt = Instant.now();
        RunContext run = new RunContext(updateId, options);
        LoggingConfig.setUpdateContext(updateId);

        try {
            LiveUpdateResult result;
            try {
                result = execute(current, desired, run);
            } catch (RollbackFailedException e) {
                finish(run, startedAt, "failed");
                throw e;
            } catch (RuntimeException e) {
                log.error("Unexpected error during live update {}", updateId, e);
                try {
                    result = failUnexpected(run, e);
                } catch (RollbackFailedException rollbackFailed) {
                    finish(run, startedAt, "failed");
                    throw rollbackFailed;
                }
            }
            finish(run, startedAt, result.outcome());
            return result;
        } finally {
            phases.reset();
            LoggingConfig.clearUpdateContext();
            runLock.unlock();
        }
    }

    private LiveUpdateResult execute(SystemConfiguration current, SystemConfiguration desired, RunContext run) {
        LiveUpdateOptions options = run.options;
        notifier.updateStarted(desired);
        structuredLogger.update().started(desired.system().hostname(), desired.packages().size(), desired.services().size());
        phases.transition(UpdatePhase.DETECTING);

        List<ConfigChange> changes;
        CategorizedChanges categorized;
        try {
            changes = changeDetector.detectChanges(current, desired);
            if (changes.isEmpty()) {
                phases.transition(UpdatePhase.COMMITTED);
                notifier.noChanges();
                return LiveUpdateResult.NoChangesRequired.INSTANCE;
            }
            recordDetected(changes);

            phases.transition(UpdatePhase.CLASSIFYING);
            categorized = classifier.categorize(changes);
        } catch (ReconcilerException e) {
            return fail(run, e, List.of(), List.of(), false);
        }

        if (categorized.requiresReboot() && !options.allowPartialUpdate()) {
            phases.transition(UpdatePhase.REBOOT_BLOCKED);
            notifier.rebootRequired(categorized.rebootRequired());
            structuredLogger.update().blocked(categorized.rebootRequired().size());
            return new LiveUpdateResult.RebootRequired(categorized.rebootRequired());
        }

        phases.transition(UpdatePhase.APPLYING);

        if (!options.dryRun()) {
            try {
                run.snapshot = stateSync.createSnapshot();
            } catch (ReconcilerException e) {
                // Nothing applied yet, so there is nothing to roll back
                return fail(run, e, List.of(), List.of(), false);
            }
        }

        ApplyOutcome outcome = applyAll(categorized, run);

        if (outcome.abortCause != null) {
            boolean rolledBack = rollbackIfRequested(run, outcome.abortCause);
            String reason = outcome.failed.isEmpty()
                ? outcome.abortCause.getMessage()
                : "Failed to apply change: " + outcome.failed.get(outcome.failed.size() - 1).change().description();
            LiveUpdateException abort = new LiveUpdateException(reason, outcome.abortCause);
            return fail(run, abort, outcome.applied, outcome.failed, rolledBack);
        }

        if (!options.dryRun()) {
            try {
                stateSync.syncState(desired);
            } catch (ReconcilerException e) {
                boolean rolledBack = rollbackIfRequested(run, e);
                return fail(run, e, outcome.applied, outcome.failed, rolledBack);
            }
        }

        phases.transition(UpdatePhase.COMMITTED);
        List<ConfigChange> pending = categorized.rebootRequired();
        run.pendingReboot = pending.size();
        notifier.updateCompleted(outcome.applied.size(), outcome.failed.size(), pending.size());

        if (outcome.failed.isEmpty()) {
            return new LiveUpdateResult.Success(outcome.applied, pending);
        }
        return new LiveUpdateResult.PartialSuccess(outcome.applied, outcome.failed, pending);
    }

    // ==================== Change Application ====================

    /**
     * Live changes first, grouped by resource key and run on a bounded pool; then reloads in order.
     */
    private ApplyOutcome applyAll(CategorizedChanges categorized, RunContext run) {
        List<ConfigChange> ordered = new ArrayList<>(categorized.live());
        ordered.addAll(categorized.serviceReload());
        Map<ConfigChange, Integer> order = new IdentityHashMap<>();
        for (int i = 0; i < ordered.size(); i++) {
            order.put(ordered.get(i), i);
        }

        ApplyOutcome outcome = new ApplyOutcome(order);
        run.outcome = outcome;
        applyLiveGroups(categorized.live(), run, outcome);

        for (ConfigChange change : categorized.serviceReload()) {
            if (outcome.aborted.get()) {
                break;
            }
            applyOne(change, run, outcome, false);
        }

        outcome.sort();
        return outcome;
    }

    private void applyLiveGroups(List<ConfigChange> live, RunContext run, ApplyOutcome outcome) {
        if (live.isEmpty()) {
            return;
        }
        Map<String, List<ConfigChange>> groups = new LinkedHashMap<>();
        for (ConfigChange change : live) {
            groups.computeIfAbsent(change.resourceKey(), key -> new ArrayList<>()).add(change);
        }

        int threads = Math.min(run.options.maxParallelOperations(), groups.size());
        ExecutorService pool = Executors.newFixedThreadPool(threads, workerThreads(run.updateId));
        Map<String, String> mdc = MDC.getCopyOfContextMap();

        try {
            List<Future<?>> futures = new ArrayList<>();
            for (List<ConfigChange> group : groups.values()) {
                futures.add(pool.submit(() -> {
                    if (mdc != null) {
                        MDC.setContextMap(mdc);
                    }
                    try {
                        for (ConfigChange change : group) {
                            if (outcome.aborted.get()) {
                                return;
                            }
                            applyOne(change, run, outcome, true);
                        }
                    } finally {
                        MDC.clear();
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outcome.abort(new LiveUpdateException("Live update interrupted", e));
        } catch (ExecutionException e) {
            outcome.abort(new LiveUpdateException("Live change worker failed", e.getCause()));
        } finally {
            pool.shutdownNow();
        }
    }

    private static ThreadFactory workerThreads(String updateId) {
        AtomicInteger counter = new AtomicInteger();
        String prefix = "live-update-" + updateId.substring(0, 8) + "-";
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private void applyOne(ConfigChange change, RunContext run, ApplyOutcome outcome, boolean live) {
        String strategy = change.updateStrategy().name();
        LoggingConfig.setOperationContext(change.type().name(), change.resourceKey());
        try {
            if (live) {
                applier.applyLive(change, run.options.dryRun());
            } else {
                applier.applyReload(change, run.options.dryRun());
            }
            outcome.applied(change);
            run.appliedCount.incrementAndGet();
            metricsRegistry.recordChangeApplied(change.type().name(), strategy);
            structuredLogger.update().changeApplied(change.type().name(), change.description(),
                String.valueOf(change.impactLevel()));
            notifier.changeApplied(change);
        } catch (RuntimeException e) {
            FailedChange failed = FailedChange.of(change, e);
            outcome.failed(failed);
            run.failedCount.incrementAndGet();
            metricsRegistry.recordChangeFailed(change.type().name(), strategy);
            structuredLogger.update().changeFailed(change.type().name(), change.description(),
                failed.errorCode(), failed.error());
            notifier.changeFailed(change, e);

            if (!run.options.continueOnError()) {
                outcome.abort(e);
            }
        } finally {
            LoggingConfig.clearOperationContext();
        }
    }

    // ==================== Rollback / Failure ====================

    private boolean rollbackIfRequested(RunContext run, Throwable cause) {
        if (!run.options.rollbackOnFailure() || run.snapshot == null) {
            return false;
        }

        String snapshotId = run.snapshot.id();
        notifier.rollbackStarted();
        structuredLogger.update().rollback(LogEventType.ROLLBACK_STARTED, snapshotId, cause.getMessage());

        try {
            stateSync.restoreSnapshot(run.snapshot);
        } catch (RuntimeException rollbackError) {
            metricsRegistry.recordRollback(false);
            structuredLogger.update().rollback(LogEventType.ROLLBACK_FAILED, snapshotId, rollbackError.getMessage());
            notifier.rollbackFailed(rollbackError);
            phases.transition(UpdatePhase.FAILED);
            throw new RollbackFailedException(snapshotId, rollbackError, cause);
        }

        metricsRegistry.recordRollback(true);
        structuredLogger.update().rollback(LogEventType.ROLLBACK_COMPLETED, snapshotId, null);
        notifier.rollbackCompleted();
        return true;
    }

    private LiveUpdateResult fail(RunContext run, ReconcilerException error, List<ConfigChange> applied,
                                  List<FailedChange> failed, boolean rolledBack) {
        phases.transition(rolledBack ? UpdatePhase.ROLLED_BACK : UpdatePhase.FAILED);
        notifier.updateFailed(error);
        log.error("Live update {} failed ({}): {}", run.updateId, error.getErrorCode().getCode(), error.getMessage());
        return new LiveUpdateResult.Failed(error.getErrorCode().getCode(), error.getMessage(), applied, failed, rolledBack);
    }

    /**
     * Reports whatever was applied before the error and restores the snapshot when the run was
     * still applying. A committed run is not rolled back.
     */
    private LiveUpdateResult failUnexpected(RunContext run, RuntimeException error) {
        ApplyOutcome outcome = run.outcome;
        List<ConfigChange> applied = outcome != null ? outcome.appliedSoFar() : List.of();
        List<FailedChange> failed = outcome != null ? outcome.failedSoFar() : List.of();

        boolean rolledBack = phases.current() == UpdatePhase.APPLYING && rollbackIfRequested(run, error);

        UpdatePhase phase = phases.current();
        if (!phase.isTerminal() && phase != UpdatePhase.IDLE) {
            phases.transition(rolledBack ? UpdatePhase.ROLLED_BACK : UpdatePhase.FAILED);
        }
        notifier.updateFailed(error);

        String code = error instanceof ReconcilerException re
            ? re.getErrorCode().getCode()
            : ErrorCode.LIVE_UPDATE_FAILED.getCode();
        return new LiveUpdateResult.Failed(code, String.valueOf(error.getMessage()), applied, failed, rolledBack);
    }

    private void finish(RunContext run, Instant startedAt, String outcome) {
        Instant finishedAt = Instant.now();
        long durationMs = Duration.between(startedAt, finishedAt).toMillis();
        UpdatePhase finalPhase = phases.current();

        lastRun = new UpdateRunSummary(run.updateId, startedAt, finishedAt, finalPhase, outcome,
            run.options.dryRun(), run.snapshot != null ? run.snapshot.id() : null);
        metricsRegistry.recordUpdateResult(outcome, durationMs);

        if (finalPhase == UpdatePhase.FAILED || finalPhase == UpdatePhase.ROLLED_BACK) {
            structuredLogger.update().failed(ErrorCode.LIVE_UPDATE_FAILED.getCode(), outcome, durationMs);
        } else {
            structuredLogger.update().completed(outcome, run.appliedCount.get(), run.failedCount.get(),
                run.pendingReboot, durationMs);
        }
    }

    private void recordDetected(List<ConfigChange> changes) {
        Map<ChangeType, Long> counts = new LinkedHashMap<>();
        changes.forEach(change -> counts.merge(change.type(), 1L, Long::sum));
        counts.forEach((type, count) -> metricsRegistry.recordChangesDetected(type.name(), count.intValue()));
        log.info("Detected {} changes: {}", changes.size(), counts);
    }

    // ==================== Preview / Status ====================

    /**
     * Preview a run without touching the host.
     */
    public LiveUpdateCapability canApplyLiveUpdates(SystemConfiguration current, SystemConfiguration desired) {
        CategorizedChanges categorized = classifier.categorize(changeDetector.detectChanges(current, desired));
        return new LiveUpdateCapability(
            !categorized.requiresReboot(),
            categorized.applicableCount(),
            categorized.rebootRequired().size(),
            estimateDuration(categorized));
    }

    static Duration estimateDuration(CategorizedChanges categorized) {
        long seconds = 0;
        for (ConfigChange change : categorized.live()) {
            seconds += switch (change.type()) {
                case PACKAGE_INSTALL -> 30L * change.newValues(Object.class).size();
                case PACKAGE_REMOVE -> 10L * change.oldValues(Object.class).size();
                case USER_ADD -> 5L;
                case USER_MODIFY -> 3L;
                default -> 2L;
            };
        }
        seconds += 5L * categorized.serviceReload().size();
        return Duration.ofSeconds(seconds);
    }

    public List<ConfigChange> previewChanges(SystemConfiguration current, SystemConfiguration desired) {
        CategorizedChanges categorized = classifier.categorize(changeDetector.detectChanges(current, desired));
        List<ConfigChange> all = new ArrayList<>(categorized.live());
        all.addAll(categorized.serviceReload());
        all.addAll(categorized.rebootRequired());
        return all;
    }

    public UpdatePhase currentPhase() {
        return phases.current();
    }

    public Optional<UpdateRunSummary> lastRun() {
        return Optional.ofNullable(lastRun);
    }

    public boolean isRunning() {
        return runLock.isLocked();
    }

    // ==================== Run State ====================

    private static final class RunContext {
        private final String updateId;
        private final LiveUpdateOptions options;
        private final AtomicInteger appliedCount = new AtomicInteger();
        private final AtomicInteger failedCount = new AtomicInteger();
        private StateSnapshot snapshot;
        private ApplyOutcome outcome;
        private int pendingReboot;

        private RunContext(String updateId, LiveUpdateOptions options) {
            this.updateId = updateId;
            this.options = options;
        }
    }

    /**
     * Applied and failed changes collected from worker threads, re-sorted into detection order.
     */
    private static final class ApplyOutcome {
        private final Map<ConfigChange, Integer> order;
        private final List<ConfigChange> applied = Collections.synchronizedList(new ArrayList<>());
        private final List<FailedChange> failed = Collections.synchronizedList(new ArrayList<>());
        private final AtomicBoolean aborted = new AtomicBoolean();
        private volatile Throwable abortCause;

        private ApplyOutcome(Map<ConfigChange, Integer> order) {
            this.order = order;
        }

        void applied(ConfigChange change) {
            applied.add(change);
        }

        void failed(FailedChange change) {
            failed.add(change);
        }

        void abort(Throwable cause) {
            if (aborted.compareAndSet(false, true)) {
                abortCause = cause;
            }
        }

        void sort() {
            synchronized (applied) {
                applied.sort(Comparator.comparingInt(order::get));
            }
            synchronized (failed) {
                failed.sort(Comparator.comparingInt(f -> order.get(f.change())));
            }
        }

        List<ConfigChange> appliedSoFar() {
            synchronized (applied) {
                applied.sort(Comparator.comparingInt(order::get));
                return List.copyOf(applied);
            }
        }

        List<FailedChange> failedSoFar() {
            synchronized (failed) {
                failed.sort(Comparator.comparingInt(f -> order.get(f.change())));
                return List.copyOf(failed);
            }
        }
    }
}
