package io.deskflow.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class DeskFlowConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE = "deskflow-settings.json";
    public static final String RUN_LOCK_FILE = "runner.lock";

    private final Path rootDir;

    public DeskFlowConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static DeskFlowConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new DeskFlowConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("deskflow.db");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path runsRoot() {
        return rootDir.resolve("runs");
    }

    public Path runLockFile() {
        return runsRoot().resolve(RUN_LOCK_FILE);
    }

    public Path runDir(String runId) {
        return runsRoot().resolve(runId);
    }

    public Path jobLocksRoot() {
        return runsRoot().resolve("jobs");
    }

    public Path flowsRoot() {
        return rootDir.resolve("flows");
    }

    public Path publishedRoot() {
        return rootDir.resolve("published");
    }

    public Path approvalsRoot() {
        return rootDir.resolve("approvals");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path auditSigningKeyFile() {
        return auditRoot().resolve("audit-signing.key");
    }

    public Path reportsRoot() {
        return rootDir.resolve("reports");
    }

    public Path logsRoot() {
        return rootDir.resolve("logs");
    }

    public Path logFile() {
        return logsRoot().resolve("deskflow.log");
    }
}
