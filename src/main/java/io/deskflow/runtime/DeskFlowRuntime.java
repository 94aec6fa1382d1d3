package io.deskflow.runtime;

import io.deskflow.DeskFlowException;
import io.deskflow.action.ActionBackends;
import io.deskflow.action.ActionDispatcher;
import io.deskflow.action.ActionRegistry;
import io.deskflow.action.BuiltinActions;
import io.deskflow.action.desktop.CaptureStore;
import io.deskflow.config.DeskFlowConfig;
import io.deskflow.config.RuntimeSettings;
import io.deskflow.config.RuntimeSettings.JobSettings;
import io.deskflow.flow.FlowDocuments;
import io.deskflow.lock.FileLock;
import io.deskflow.lock.LockStamp;
import io.deskflow.model.Flow;
import io.deskflow.model.RunRecord;
import io.deskflow.model.RunTrigger;
import io.deskflow.observability.AuditLogger;
import io.deskflow.observability.AuditLogger.AuditEvent;
import io.deskflow.observability.PrometheusFormatter;
import io.deskflow.observability.StatsAggregator;
import io.deskflow.observability.StatsHtmlRenderer;
import io.deskflow.observability.StatsSnapshot;
import io.deskflow.scheduler.Conditions;
import io.deskflow.scheduler.CronExpression;
import io.deskflow.scheduler.CronScheduler;
import io.deskflow.scheduler.EnvironmentSensor;
import io.deskflow.scheduler.ScheduledJob;
import io.deskflow.storage.Database;
import io.deskflow.storage.FlowStore;
import io.deskflow.storage.RunStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import java.util.stream.Stream;

/**
 * Wires storage, actions, the runner and observability for one data root.
 */
public final class DeskFlowRuntime {
    private static final Logger log = LoggerFactory.getLogger(DeskFlowRuntime.class);

    private final DeskFlowConfig config;
    private final RuntimeSettings settings;
    private final Database database;
    private final RunStore runStore;
    private final FlowStore flowStore;
    private final AuditLogger auditLogger;
    private final ActionRegistry registry;
    private final CaptureStore captures;
    private final StatsAggregator aggregator;
    private final FileLock fileLock;
    private final FlowRunner runner;

    public DeskFlowRuntime(DeskFlowConfig config) {
        this(config, ActionBackends.unavailable());
    }

    public DeskFlowRuntime(DeskFlowConfig config, ActionBackends backends) {
        this.config = config;
        this.settings = RuntimeSettings.load(config.settingsFile());
        this.database = new Database(config);
        this.runStore = new RunStore(database);
        this.flowStore = new FlowStore(config);
        this.auditLogger = new AuditLogger(config.auditFile(), loadOrCreateAuditSigningSecret(config.auditSigningKeyFile()));
        this.captures = new CaptureStore();
        this.registry = BuiltinActions.install(new ActionRegistry(), backends, captures);
        this.aggregator = new StatsAggregator();
        this.fileLock = new FileLock(holderId(), settings.staleLockMs());
        this.runner = new FlowRunner(
                new ActionDispatcher(registry),
                fileLock,
                config.runLockFile(),
                new RoleGuard(settings.missingRoleKeyPolicy()),
                flowStore,
                auditLogger,
                config.runsRoot()
        );
        runner.addListener(runStore::append);
        runner.addListener(aggregator::accept);
    }

    public void init() {
        database.init();
        List<RunRecord> history = runStore.loadAll();
        aggregator.acceptAll(history);
        log.info("DeskFlow initialized at {} ({} runs in history)", config.rootDir(), history.size());
    }

    public DeskFlowConfig config() {
        return config;
    }

    public RuntimeSettings settings() {
        return settings;
    }

    public ActionRegistry registry() {
        return registry;
    }

    public CaptureStore captures() {
        return captures;
    }

    public FlowRunner runner() {
        return runner;
    }

    public FlowStore flowStore() {
        return flowStore;
    }

    public RunStore runStore() {
        return runStore;
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    public StatsAggregator aggregator() {
        return aggregator;
    }

    public FileLock fileLock() {
        return fileLock;
    }

    /**
     * Loads a flow by stored name, or from a flow document when {@code ref} names an
     * existing {@code .json} file.
     */
    public Flow loadFlow(String ref) {
        Path file = Path.of(ref);
        if (ref.endsWith(".json") && Files.isRegularFile(file)) {
            return FlowDocuments.read(file);
        }
        return flowStore.load(ref)
                .orElseThrow(() -> new DeskFlowException("flow_not_found", "Flow not found: " + ref));
    }

    public RunRecord run(String flowRef, Map<String, Object> vars, String role) {
        return runner.execute(loadFlow(flowRef), vars, role, RunTrigger.MANUAL);
    }

    public StatsSnapshot stats() {
        return aggregator.snapshot();
    }

    public String statsHtml() {
        return StatsHtmlRenderer.render(aggregator.snapshot(), LocalDate.now(aggregator.zone()));
    }

    public String metricsText() {
        return PrometheusFormatter.format(aggregator.snapshot());
    }

    /**
     * State of the run lock and every job lock under the data root.
     */
    public List<Map<String, Object>> lockStatus() {
        List<Path> paths = new ArrayList<>();
        paths.add(config.runLockFile());
        Path jobs = config.jobLocksRoot();
        if (Files.isDirectory(jobs)) {
            try (Stream<Path> stream = Files.list(jobs)) {
                stream.filter(p -> p.getFileName().toString().endsWith(".lock")).sorted().forEach(paths::add);
            } catch (IOException e) {
                throw new RuntimeException("Failed to list job locks: " + jobs, e);
            }
        }
        List<Map<String, Object>> out = new ArrayList<>();
        for (Path path : paths) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("path", path.toString());
            row.put("held", fileLock.isHeld(path));
            Optional<LockStamp> stamp = fileLock.readStamp(path);
            row.put("holder", stamp.map(LockStamp::holder).orElse(null));
            row.put("pid", stamp.map(LockStamp::pid).orElse(null));
            row.put("age_ms", fileLock.ageMs(path));
            out.add(row);
        }
        return out;
    }

    /**
     * Removes a leftover lock marker. Without {@code force} only markers older than
     * {@code minAgeMs} are removed.
     */
    public boolean clearLock(Path path, boolean force, long minAgeMs) {
        boolean cleared = force ? fileLock.release(path) : fileLock.clearIfStale(path, Math.max(1L, minAgeMs));
        auditLogger.log(AuditEvent.of("lock.clear", "cli", path.toString(), cleared ? "cleared" : "kept",
                Map.of("force", force)));
        return cleared;
    }

    /**
     * Builds a scheduler with one job per configured entry. Jobs run their flow as
     * a scheduled run under their own lock; the run lock still serializes flows.
     */
    public CronScheduler buildScheduler(EnvironmentSensor sensor) {
        CronScheduler scheduler = new CronScheduler(fileLock, config.reportsRoot(),
                settings.schedulerWorkers(), settings.schedulerPollMs());
        scheduler.addListener(runStore::append);
        scheduler.addListener(aggregator::accept);
        for (JobSettings job : settings.jobs()) {
            List<BooleanSupplier> conditions = new ArrayList<>();
            for (String name : job.conditions()) {
                conditions.add(Conditions.named(name, sensor));
            }
            Path lock = job.lock() == null || job.lock().isBlank()
                    ? config.jobLocksRoot().resolve(job.id() + ".lock")
                    : config.rootDir().resolve(job.lock());
            String flowName = job.flow();
            String role = job.role();
            scheduler.addJob(new ScheduledJob(
                    job.id(),
                    CronExpression.parse(job.cron()),
                    () -> runner.execute(loadFlow(flowName), Map.of(), role, RunTrigger.SCHEDULED),
                    lock,
                    conditions,
                    config.logFile()
            ));
        }
        return scheduler;
    }

    private static String holderId() {
        return "deskflow-" + ManagementFactory.getRuntimeMXBean().getName();
    }

    private static String loadOrCreateAuditSigningSecret(Path keyFile) {
        try {
            if (keyFile.getParent() != null) {
                Files.createDirectories(keyFile.getParent());
            }
            if (Files.exists(keyFile)) {
                String existing = Files.readString(keyFile, StandardCharsets.UTF_8).trim();
                if (!existing.isBlank()) {
                    return existing;
                }
            }
            byte[] random = new byte[32];
            new SecureRandom().nextBytes(random);
            String generated = Base64.getEncoder().encodeToString(random);
            Files.writeString(keyFile, generated, StandardCharsets.UTF_8);
            return generated;
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit signing secret: " + keyFile, e);
        }
    }
}
