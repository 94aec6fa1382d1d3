package io.deskflow.scheduler;

import io.deskflow.DeskFlowException;
import io.deskflow.lock.FileLock;
import io.deskflow.lock.LockBusyException;
import io.deskflow.lock.LockHandle;
import io.deskflow.model.RunRecord;
import io.deskflow.model.RunTrigger;
import io.deskflow.runtime.RunListener;
import io.deskflow.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.InetAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;

/**
 * Fires jobs on cron schedules from one polling thread onto a worker pool.
 *
 * <p>For each due job the polling thread evaluates the conditions, then takes the
 * job lock; a false condition or a held lock skips that firing. The target then
 * runs on a worker, which releases the lock when the target returns or throws. A
 * throwing target leaves a crash report in the reports directory and does not
 * affect other jobs.
 *
 * <p>Targets that are not flow runs get a {@link RunRecord} published under
 * {@code job:<id>}; a target returning a RunRecord has already published it.
 */
public final class CronScheduler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CronScheduler.class);
    static final int MAX_CATCH_UP_SECONDS = 5;
    static final int LOG_TAIL_LINES = 200;
    private static final long SHUTDOWN_WAIT_MS = 10_000L;

    private final FileLock fileLock;
    private final Path reportsDir;
    private final long pollMs;
    private final Clock clock;
    private final ExecutorService workers;
    private final List<JobState> jobs = new CopyOnWriteArrayList<>();
    private final List<RunListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicLong jobSeq = new AtomicLong(0L);
    private ScheduledExecutorService poller;
    private LocalDateTime lastEvaluated;

    public CronScheduler(FileLock fileLock, Path reportsDir, int workerThreads, long pollMs) {
        this(fileLock, reportsDir, workerThreads, pollMs, Clock.systemDefaultZone());
    }

    public CronScheduler(FileLock fileLock, Path reportsDir, int workerThreads, long pollMs, Clock clock) {
        this.fileLock = fileLock;
        this.reportsDir = reportsDir;
        this.pollMs = Math.max(10L, pollMs);
        this.clock = clock;
        AtomicInteger threadSeq = new AtomicInteger(0);
        this.workers = Executors.newFixedThreadPool(Math.max(1, workerThreads), runnable -> {
            Thread thread = new Thread(runnable, "deskflow-job-" + threadSeq.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public void addListener(RunListener listener) {
        listeners.add(listener);
    }

    public ScheduledJob addJob(String cronExpression, Callable<?> target, Path lockPath) {
        return addJob(cronExpression, target, lockPath, List.of());
    }

    public ScheduledJob addJob(String cronExpression, Callable<?> target, Path lockPath, List<BooleanSupplier> conditions) {
        String id = "job-" + jobSeq.incrementAndGet();
        return addJob(new ScheduledJob(id, CronExpression.parse(cronExpression), target, lockPath, conditions, null));
    }

    public ScheduledJob addJob(ScheduledJob job) {
        for (JobState existing : jobs) {
            if (existing.job.id().equals(job.id())) {
                throw new IllegalArgumentException("Duplicate job id: " + job.id());
            }
        }
        jobs.add(new JobState(job));
        log.info("Scheduled job {} ({}) with lock {}", job.id(), job.cron(), job.lockPath());
        return job;
    }

    /**
     * Evaluates every job against {@code now} (truncated to the second) and fires
     * the due ones. Skipped firings come back as completed futures.
     */
    public List<Future<JobFiring>> runPending(LocalDateTime now) {
        LocalDateTime at = now.truncatedTo(ChronoUnit.SECONDS);
        List<Future<JobFiring>> out = new ArrayList<>();
        for (JobState state : jobs) {
            if (state.job.cron().matches(at)) {
                out.add(fire(state, at));
            }
        }
        return out;
    }

    public synchronized void start() {
        if (poller != null) {
            return;
        }
        lastEvaluated = LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS).minusSeconds(1);
        poller = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "deskflow-scheduler");
            thread.setDaemon(true);
            return thread;
        });
        poller.scheduleWithFixedDelay(this::tick, 0L, pollMs, TimeUnit.MILLISECONDS);
        log.info("Scheduler started with {} jobs, polling every {}ms", jobs.size(), pollMs);
    }

    public synchronized boolean isRunning() {
        return poller != null;
    }

    /**
     * Stops polling and waits for in-flight targets to return.
     */
    public synchronized void stop() {
        if (poller != null) {
            poller.shutdownNow();
            poller = null;
        }
        workers.shutdown();
        try {
            if (!workers.awaitTermination(SHUTDOWN_WAIT_MS, TimeUnit.MILLISECONDS)) {
                log.warn("Job workers still busy after {}ms, interrupting", SHUTDOWN_WAIT_MS);
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Scheduler stopped");
    }

    @Override
    public void close() {
        stop();
    }

    public List<JobStatus> jobs() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<JobStatus> out = new ArrayList<>();
        for (JobState state : jobs) {
            Map<JobOutcome, Long> counts = new EnumMap<>(JobOutcome.class);
            state.counts.forEach((outcome, count) -> counts.put(outcome, count.get()));
            out.add(new JobStatus(
                    state.job.id(),
                    state.job.cron().expression(),
                    state.job.lockPath().toString(),
                    state.job.cron().nextFireAfter(now).orElse(null),
                    state.last,
                    counts
            ));
        }
        return out;
    }

    void tick() {
        try {
            LocalDateTime now = LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
            LocalDateTime from;
            synchronized (this) {
                if (lastEvaluated == null || now.isBefore(lastEvaluated)) {
                    lastEvaluated = now.minusSeconds(1);
                }
                from = lastEvaluated.plusSeconds(1);
                lastEvaluated = now;
            }
            long behind = Duration.between(from, now).getSeconds();
            if (behind > MAX_CATCH_UP_SECONDS) {
                log.warn("Scheduler fell {}s behind; only the last {}s are evaluated", behind, MAX_CATCH_UP_SECONDS);
                from = now.minusSeconds(MAX_CATCH_UP_SECONDS);
            }
            for (LocalDateTime t = from; !t.isAfter(now); t = t.plusSeconds(1)) {
                runPending(t);
            }
        } catch (RuntimeException e) {
            // An escaping exception would cancel the periodic task.
            log.error("Scheduler tick failed", e);
        }
    }

    private Future<JobFiring> fire(JobState state, LocalDateTime at) {
        ScheduledJob job = state.job;
        if (!conditionsHold(job)) {
            log.info("Job {} skipped at {}: condition not met", job.id(), at);
            return CompletableFuture.completedFuture(state.record(JobFiring.skipped(job.id(), at, JobOutcome.SKIPPED_CONDITION)));
        }
        LockHandle handle;
        try {
            handle = fileLock.acquire(job.lockPath());
        } catch (LockBusyException e) {
            log.info("Job {} skipped at {}: previous firing still holds {}", job.id(), at, job.lockPath());
            return CompletableFuture.completedFuture(state.record(JobFiring.skipped(job.id(), at, JobOutcome.SKIPPED_OVERLAP)));
        }
        try {
            return workers.submit(() -> execute(state, at, handle));
        } catch (RejectedExecutionException e) {
            handle.release();
            long now = System.currentTimeMillis();
            return CompletableFuture.completedFuture(state.record(new JobFiring(job.id(), at, JobOutcome.FAILED,
                    now, now, "scheduler is stopped", null)));
        }
    }

    private boolean conditionsHold(ScheduledJob job) {
        try {
            return Conditions.allTrue(job.conditions());
        } catch (RuntimeException e) {
            log.warn("Condition of job {} failed, treating as false: {}", job.id(), e.getMessage());
            return false;
        }
    }

    private JobFiring execute(JobState state, LocalDateTime at, LockHandle handle) {
        ScheduledJob job = state.job;
        long startedAt = System.currentTimeMillis();
        try (handle) {
            Object result = job.target().call();
            long endedAt = System.currentTimeMillis();
            if (result instanceof RunRecord record) {
                JobOutcome outcome = record.succeeded() ? JobOutcome.COMPLETED : JobOutcome.FAILED;
                return state.record(new JobFiring(job.id(), at, outcome, startedAt, endedAt, record.error(), null));
            }
            publish(RunRecord.success(UUID.randomUUID().toString(), "job:" + job.id(), RunTrigger.SCHEDULED,
                    startedAt, endedAt, List.of()));
            return state.record(new JobFiring(job.id(), at, JobOutcome.COMPLETED, startedAt, endedAt, null, null));
        } catch (LockBusyException e) {
            log.info("Job {} skipped at {}: {}", job.id(), at, e.getMessage());
            return state.record(JobFiring.skipped(job.id(), at, JobOutcome.SKIPPED_OVERLAP));
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            long endedAt = System.currentTimeMillis();
            Path report = writeCrashReport(job, at, e);
            log.error("Job {} crashed at {}; report written to {}", job.id(), at, report, e);
            String reason = e instanceof DeskFlowException d ? d.reason() : "internal_error";
            publish(RunRecord.failed(UUID.randomUUID().toString(), "job:" + job.id(), RunTrigger.SCHEDULED,
                    startedAt, endedAt, null, reason, String.valueOf(e.getMessage()), List.of()));
            return state.record(new JobFiring(job.id(), at, JobOutcome.FAILED, startedAt, endedAt,
                    String.valueOf(e.getMessage()), report));
        }
    }

    private void publish(RunRecord record) {
        for (RunListener listener : listeners) {
            try {
                listener.onRun(record);
            } catch (RuntimeException e) {
                log.warn("Run listener failed for job record {}: {}", record.flowName(), e.getMessage());
            }
        }
    }

    Path writeCrashReport(ScheduledJob job, LocalDateTime at, Throwable error) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("job_id", job.id());
        data.put("cron", job.cron().expression());
        data.put("scheduled_for", at.toString());
        data.put("error", String.valueOf(error.getMessage()));
        data.put("error_type", error.getClass().getName());
        StringWriter trace = new StringWriter();
        error.printStackTrace(new PrintWriter(trace));
        data.put("stack_trace", trace.toString());
        data.put("env", environment());
        data.put("log", tail(job.logFile()));
        Path file = reportsDir.resolve("crash_" + System.currentTimeMillis() + "_" + safe(job.id()) + ".json");
        try {
            Files.createDirectories(reportsDir);
            Files.writeString(file, Jsons.toJson(data), StandardCharsets.UTF_8);
            return file;
        } catch (IOException e) {
            log.error("Failed to write crash report for job {}: {}", job.id(), e.getMessage());
            return null;
        }
    }

    private static Map<String, Object> environment() {
        Map<String, Object> env = new LinkedHashMap<>();
        env.put("java", System.getProperty("java.version"));
        env.put("java_vendor", System.getProperty("java.vendor"));
        env.put("os", System.getProperty("os.name") + " " + System.getProperty("os.version"));
        env.put("arch", System.getProperty("os.arch"));
        try {
            env.put("host", InetAddress.getLocalHost().getHostName());
        } catch (IOException e) {
            env.put("host", "unknown");
        }
        return env;
    }

    private static String tail(Path logFile) {
        if (logFile == null || !Files.isRegularFile(logFile)) {
            return "";
        }
        try {
            List<String> lines = Files.readAllLines(logFile, StandardCharsets.UTF_8);
            int from = Math.max(0, lines.size() - LOG_TAIL_LINES);
            return String.join(System.lineSeparator(), lines.subList(from, lines.size()));
        } catch (IOException e) {
            return "<unreadable log: " + e.getMessage() + ">";
        }
    }

    private static String safe(String id) {
        return id.replaceAll("[^A-Za-z0-9_.-]", "_");
    }

    private static final class JobState {
        private final ScheduledJob job;
        private final Map<JobOutcome, AtomicLong> counts = new EnumMap<>(JobOutcome.class);
        private volatile JobFiring last;

        JobState(ScheduledJob job) {
            this.job = job;
            for (JobOutcome outcome : JobOutcome.values()) {
                counts.put(outcome, new AtomicLong(0L));
            }
        }

        JobFiring record(JobFiring firing) {
            counts.get(firing.outcome()).incrementAndGet();
            last = firing;
            return firing;
        }
    }
}
