package io.deskflow.storage;

import io.deskflow.config.DeskFlowConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

public final class Database {
    private final DeskFlowConfig config;
    private final String jdbcUrl;

    public Database(DeskFlowConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl);
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.runsRoot());
            Files.createDirectories(config.jobLocksRoot());
            Files.createDirectories(config.flowsRoot());
            Files.createDirectories(config.publishedRoot());
            Files.createDirectories(config.approvalsRoot());
            Files.createDirectories(config.auditRoot());
            Files.createDirectories(config.reportsRoot());
            Files.createDirectories(config.logsRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS runs (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        run_id TEXT UNIQUE,
                        flow_name TEXT,
                        start_time REAL,
                        end_time REAL,
                        duration REAL,
                        success INTEGER,
                        failure_reason TEXT,
                        selector_hit_rate REAL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS selector_stats (
                        selector TEXT PRIMARY KEY,
                        success_count INTEGER DEFAULT 0,
                        failure_count INTEGER DEFAULT 0
                    )
                    """);
            ensureRunColumns(conn);
            st.execute("CREATE INDEX IF NOT EXISTS idx_runs_flow_start ON runs(flow_name, start_time)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_runs_start ON runs(start_time)");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize SQLite schema", e);
        }
    }

    // Databases written by older tools only carry the first nine columns.
    private void ensureRunColumns(Connection conn) throws SQLException {
        Set<String> columns = new HashSet<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(runs)")) {
            while (rs.next()) {
                columns.add(rs.getString("name").toLowerCase(Locale.ROOT));
            }
        }
        try (Statement st = conn.createStatement()) {
            if (!columns.contains("status")) {
                st.execute("ALTER TABLE runs ADD COLUMN status TEXT");
            }
            if (!columns.contains("run_trigger")) {
                st.execute("ALTER TABLE runs ADD COLUMN run_trigger TEXT NOT NULL DEFAULT 'MANUAL'");
            }
            if (!columns.contains("failed_step_id")) {
                st.execute("ALTER TABLE runs ADD COLUMN failed_step_id TEXT");
            }
            if (!columns.contains("error")) {
                st.execute("ALTER TABLE runs ADD COLUMN error TEXT");
            }
            if (!columns.contains("selector_outcomes")) {
                st.execute("ALTER TABLE runs ADD COLUMN selector_outcomes TEXT");
            }
            st.execute("UPDATE runs SET status=CASE WHEN success=1 THEN 'SUCCESS' ELSE 'FAILED' END WHERE status IS NULL");
        }
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");
            st.execute("PRAGMA busy_timeout=5000");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "1");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }
}
