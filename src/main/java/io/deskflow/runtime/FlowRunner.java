package io.deskflow.runtime;

import io.deskflow.DeskFlowException;
import io.deskflow.action.ActionDispatcher;
import io.deskflow.action.ActionException;
import io.deskflow.action.ExecutionContext;
import io.deskflow.lock.FileLock;
import io.deskflow.lock.LockBusyException;
import io.deskflow.lock.LockHandle;
import io.deskflow.model.Flow;
import io.deskflow.model.FlowOperation;
import io.deskflow.model.OnError;
import io.deskflow.model.RunRecord;
import io.deskflow.model.RunTrigger;
import io.deskflow.model.SelectorOutcome;
import io.deskflow.model.Step;
import io.deskflow.observability.AuditLogger;
import io.deskflow.observability.AuditLogger.AuditEvent;
import io.deskflow.observability.StepLogWriter;
import io.deskflow.storage.FlowStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;

/**
 * Executes flows one at a time under the global run lock and gates flow
 * operations by role.
 *
 * <p>Steps run sequentially on the calling thread. A failing step is retried up
 * to its {@code retry} count, running its recovery step after each failed
 * attempt; once out of attempts it aborts the run unless its {@code onError}
 * says to continue. {@code timeoutMs} is checked when the action returns. The
 * step in progress is never interrupted.
 *
 * <p>{@link #stop()}, {@link #pause()} and {@link #skip()} take effect between
 * steps. Pause and skip belong to the runner, so a skip requested while idle
 * skips the first step of the next run. The run lock is released on every exit
 * path before the record is published to listeners.
 */
public final class FlowRunner {
    private static final Logger log = LoggerFactory.getLogger(FlowRunner.class);
    static final String SCREENSHOT_ACTION = "screenshot";
    private static final long PAUSE_POLL_MS = 100L;

    private final ActionDispatcher dispatcher;
    private final FileLock fileLock;
    private final Path runLockPath;
    private final RoleGuard roleGuard;
    private final FlowStore flowStore;
    private final AuditLogger auditLogger;
    private final Path runsRoot;
    private final List<RunListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean paused = new AtomicBoolean(false);
    private final AtomicBoolean skipNext = new AtomicBoolean(false);
    private final Object pauseMonitor = new Object();
    private volatile RunControl activeRun;

    public FlowRunner(
            ActionDispatcher dispatcher,
            FileLock fileLock,
            Path runLockPath,
            RoleGuard roleGuard,
            FlowStore flowStore,
            AuditLogger auditLogger,
            Path runsRoot
    ) {
        this.dispatcher = dispatcher;
        this.fileLock = fileLock;
        this.runLockPath = runLockPath;
        this.roleGuard = roleGuard;
        this.flowStore = flowStore;
        this.auditLogger = auditLogger;
        this.runsRoot = runsRoot;
    }

    public void addListener(RunListener listener) {
        listeners.add(listener);
    }

    public Path runLockPath() {
        return runLockPath;
    }

    public Optional<String> activeRunId() {
        RunControl run = activeRun;
        return run == null ? Optional.empty() : Optional.of(run.runId);
    }

    public RunRecord execute(Flow flow, Map<String, Object> initialVars, String actorRole) {
        return execute(flow, initialVars, actorRole, RunTrigger.MANUAL);
    }

    /**
     * @throws PermissionDeniedException when {@code actorRole} may not run the flow; no lock is taken
     * @throws LockBusyException when another run holds the run lock; manual runs still publish a FAILED record
     */
    public RunRecord execute(Flow flow, Map<String, Object> initialVars, String actorRole, RunTrigger trigger) {
        authorize(flow, FlowOperation.RUN, actorRole);
        String runId = UUID.randomUUID().toString();
        long startedAt = System.currentTimeMillis();

        LockHandle handle = acquireRunLock(runId, flow, trigger, startedAt, actorRole);
        RunControl control = new RunControl(runId);
        RunRecord record;
        try (handle) {
            activeRun = control;
            log.info("Run {} of flow '{}' started ({} steps, trigger={})", runId, flow.name(), flow.steps().size(), trigger);
            record = runSteps(control, flow, seed(flow, initialVars), trigger, startedAt);
        } finally {
            activeRun = null;
        }
        log.info("Run {} of flow '{}' finished: {}{}", runId, flow.name(), record.status(),
                record.reason() == null ? "" : " (" + record.reason() + " at step " + record.failedStepId() + ")");
        publish(record, actorRole);
        return record;
    }

    /**
     * Requests the active run to end before its next step.
     *
     * @return whether a run was active
     */
    public boolean stop() {
        RunControl run = activeRun;
        if (run == null) {
            return false;
        }
        run.stopRequested.set(true);
        wakePaused();
        return true;
    }

    /**
     * Holds the active run, and any run started later, before its next step
     * until {@link #resume()} or {@link #stop()}.
     */
    public void pause() {
        if (paused.compareAndSet(false, true)) {
            log.info("Runner paused");
        }
    }

    public void resume() {
        if (paused.compareAndSet(true, false)) {
            log.info("Runner resumed");
        }
        wakePaused();
    }

    public boolean isPaused() {
        return paused.get();
    }

    /**
     * Skips the next step to be started, without running it.
     */
    public void skip() {
        skipNext.set(true);
    }

    public Flow viewFlow(Flow flow, String actorRole) {
        authorize(flow, FlowOperation.VIEW, actorRole);
        return flow;
    }

    /**
     * Applies {@code editor} and saves the result as the flow's working copy. The
     * editor is not invoked when the role is denied.
     */
    public Flow editFlow(Flow flow, String actorRole, UnaryOperator<Flow> editor) {
        authorize(flow, FlowOperation.EDIT, actorRole);
        Flow edited = editor.apply(flow);
        flowStore.save(edited);
        return edited;
    }

    public Path publishFlow(Flow flow, String actorRole) {
        authorize(flow, FlowOperation.PUBLISH, actorRole);
        return flowStore.publish(flow);
    }

    public FlowStore.Approval approveFlow(Flow flow, String actorRole) {
        authorize(flow, FlowOperation.APPROVE, actorRole);
        return flowStore.approve(flow, actorRole);
    }

    private LockHandle acquireRunLock(String runId, Flow flow, RunTrigger trigger, long startedAt, String actorRole) {
        try {
            return fileLock.acquire(runLockPath);
        } catch (LockBusyException e) {
            log.warn("Run {} of flow '{}' rejected: {}", runId, flow.name(), e.getMessage());
            // Scheduled firings report contention as an overlap skip instead.
            if (trigger == RunTrigger.MANUAL) {
                RunRecord busy = RunRecord.failed(runId, flow.name(), trigger, startedAt, System.currentTimeMillis(),
                        null, e.reason(), e.getMessage(), List.of());
                publish(busy, actorRole);
            }
            throw e;
        }
    }

    private void authorize(Flow flow, FlowOperation operation, String actorRole) {
        boolean allowed = roleGuard.isAllowed(flow, operation, actorRole);
        audit(AuditEvent.of("flow." + operation.key(), actorRole, flow.name(), allowed ? "allowed" : "denied", Map.of()));
        if (!allowed) {
            log.warn("Role '{}' denied {} on flow '{}'", actorRole, operation.key(), flow.name());
            throw new PermissionDeniedException(flow.name(), operation, actorRole);
        }
    }

    private RunRecord runSteps(RunControl control, Flow flow, Map<String, Object> vars, RunTrigger trigger,
                               long startedAt) {
        String runId = control.runId;
        ExecutionContext context = new ExecutionContext(runId, flow.name(), vars);
        StepLogWriter stepLog = runsRoot == null ? null : new StepLogWriter(runsRoot.resolve(runId));
        List<SelectorOutcome> selectors = new ArrayList<>();
        for (Step step : flow.steps()) {
            if (!awaitResume(control)) {
                log.info("Run {} stopped before step {}", runId, step.id());
                return RunRecord.failed(runId, flow.name(), trigger, startedAt, System.currentTimeMillis(),
                        step.id(), "stopped", "run stopped before step " + step.id(), selectors);
            }
            if (skipNext.compareAndSet(true, false)) {
                log.info("Run {} skipped step {} ({})", runId, step.id(), step.action());
                if (stepLog != null) {
                    stepLog.stepSkipped(runId, step.id(), step.action(), step.params());
                }
                continue;
            }
            Optional<String> selectorKey = ActionDispatcher.selectorKey(step);
            long stepStart = System.currentTimeMillis();
            int attempts = step.effectiveRetry(flow.defaults()) + 1;
            Long timeoutMs = step.effectiveTimeoutMs(flow.defaults());
            Failure failure = null;
            for (int attempt = 1; attempt <= attempts; attempt++) {
                if (attempt > 1) {
                    log.info("Retrying step {} of run {} (attempt {} of {})", step.id(), runId, attempt, attempts);
                }
                try {
                    Object result = attempt(step, context, timeoutMs);
                    selectorKey.ifPresent(key -> selectors.add(new SelectorOutcome(step.id(), key, true)));
                    if (stepLog != null) {
                        stepLog.stepSucceeded(runId, step.id(), step.action(), step.params(),
                                System.currentTimeMillis() - stepStart, result);
                    }
                    failure = null;
                    break;
                } catch (DeskFlowException e) {
                    failure = new Failure(e.reason(), e.getMessage());
                } catch (RuntimeException e) {
                    log.error("Step {} of run {} raised an unexpected error", step.id(), runId, e);
                    failure = new Failure("internal_error", e.getClass().getSimpleName() + ": " + e.getMessage());
                }
                if (attempt < attempts) {
                    log.warn("Step {} ({}) of run {} failed attempt {} of {} [{}]: {}", step.id(), step.action(), runId,
                            attempt, attempts, failure.reason(), failure.message());
                }
                recover(runId, step, context);
            }
            if (failure == null) {
                continue;
            }
            OnError onError = step.onError();
            if (onError.screenshot()) {
                captureFailureScreenshot(runId, step, context);
            }
            RunRecord failed = stepFailed(runId, flow, trigger, startedAt, step, stepStart, selectorKey, selectors,
                    stepLog, failure.reason(), failure.message());
            if (!onError.continueRun()) {
                return failed;
            }
            log.info("Run {} continues after failed step {}", runId, step.id());
        }
        return RunRecord.success(runId, flow.name(), trigger, startedAt, System.currentTimeMillis(), selectors);
    }

    private Object attempt(Step step, ExecutionContext context, Long timeoutMs) {
        long start = System.nanoTime();
        Object result = dispatcher.invoke(step, context);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        if (timeoutMs != null && elapsedMs > timeoutMs) {
            throw ActionException.timeout(step.action(), timeoutMs);
        }
        dispatcher.bindOutput(step, result, context);
        return result;
    }

    private void recover(String runId, Step step, ExecutionContext context) {
        Step recovery = step.onError().recover();
        if (recovery == null) {
            return;
        }
        try {
            dispatcher.dispatch(recovery, context);
            log.info("Recovery {} ({}) ran for step {} of run {}", recovery.id(), recovery.action(), step.id(), runId);
        } catch (RuntimeException e) {
            log.warn("Recovery {} for step {} of run {} failed: {}", recovery.id(), step.id(), runId, e.getMessage());
        }
    }

    private void captureFailureScreenshot(String runId, Step step, ExecutionContext context) {
        if (dispatcher.registry().findByName(SCREENSHOT_ACTION).isEmpty()) {
            log.warn("No '{}' action registered; no failure screenshot for step {} of run {}",
                    SCREENSHOT_ACTION, step.id(), runId);
            return;
        }
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("fullPage", true);
        if (runsRoot != null) {
            String fileName = step.id().replaceAll("[^A-Za-z0-9._-]", "_") + "-error.png";
            params.put("path", runsRoot.resolve(runId).resolve(fileName).toString());
        }
        try {
            Object saved = dispatcher.invoke(Step.of(step.id() + ".screenshot", SCREENSHOT_ACTION, params), context);
            log.info("Failure screenshot for step {} of run {}: {}", step.id(), runId, saved);
        } catch (RuntimeException e) {
            log.warn("Failure screenshot for step {} of run {} failed: {}", step.id(), runId, e.getMessage());
        }
    }

    /**
     * Blocks while the runner is paused.
     *
     * @return false when the run was stopped or the thread interrupted
     */
    private boolean awaitResume(RunControl control) {
        synchronized (pauseMonitor) {
            while (paused.get() && !control.stopRequested.get()) {
                try {
                    pauseMonitor.wait(PAUSE_POLL_MS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
        }
        return !control.stopRequested.get();
    }

    private void wakePaused() {
        synchronized (pauseMonitor) {
            pauseMonitor.notifyAll();
        }
    }

    private RunRecord stepFailed(
            String runId,
            Flow flow,
            RunTrigger trigger,
            long startedAt,
            Step step,
            long stepStart,
            Optional<String> selectorKey,
            List<SelectorOutcome> selectors,
            StepLogWriter stepLog,
            String reason,
            String message
    ) {
        log.warn("Step {} ({}) of run {} failed [{}]: {}", step.id(), step.action(), runId, reason, message);
        selectorKey.ifPresent(key -> selectors.add(new SelectorOutcome(step.id(), key, false)));
        if (stepLog != null) {
            stepLog.stepFailed(runId, step.id(), step.action(), step.params(),
                    System.currentTimeMillis() - stepStart, reason, message);
        }
        return RunRecord.failed(runId, flow.name(), trigger, startedAt, System.currentTimeMillis(),
                step.id(), reason, message, selectors);
    }

    private void publish(RunRecord record, String actorRole) {
        for (RunListener listener : listeners) {
            try {
                listener.onRun(record);
            } catch (RuntimeException e) {
                log.warn("Run listener failed for run {}: {}", record.runId(), e.getMessage());
            }
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("status", record.status().name());
        details.put("trigger", record.trigger().name());
        details.put("duration_ms", record.durationMs());
        if (record.reason() != null) {
            details.put("reason", record.reason());
            details.put("failed_step", record.failedStepId());
        }
        audit(AuditEvent.ofRun("run.finish", actorRole, record.flowName(), record.status().name().toLowerCase(Locale.ROOT),
                record.runId(), details));
    }

    private void audit(AuditEvent event) {
        if (auditLogger != null) {
            auditLogger.log(event);
        }
    }

    private static Map<String, Object> seed(Flow flow, Map<String, Object> initialVars) {
        Map<String, Object> vars = new LinkedHashMap<>(flow.inputs());
        vars.putAll(flow.variables());
        if (initialVars != null) {
            vars.putAll(initialVars);
        }
        return vars;
    }

    private record Failure(String reason, String message) {
    }

    private static final class RunControl {
        private final String runId;
        private final AtomicBoolean stopRequested = new AtomicBoolean(false);

        private RunControl(String runId) {
            this.runId = runId;
        }
    }
}
