package io.deskflow.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import io.deskflow.model.RunRecord;
import io.deskflow.model.RunStatus;
import io.deskflow.model.RunTrigger;
import io.deskflow.model.SelectorOutcome;
import io.deskflow.util.Jsons;

import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Run history in the {@code runs} and {@code selector_stats} tables. Times are
 * stored in epoch seconds, matching rows written by earlier tools.
 */
public final class RunStore {
    private static final TypeReference<List<SelectorOutcome>> OUTCOMES_TYPE = new TypeReference<>() {
    };

    private final Database database;

    public RunStore(Database database) {
        this.database = database;
    }

    public void append(RunRecord record) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                try (PreparedStatement ps = c.prepareStatement("""
                        INSERT OR REPLACE INTO runs(run_id,flow_name,start_time,end_time,duration,success,failure_reason,
                            selector_hit_rate,status,run_trigger,failed_step_id,error,selector_outcomes)
                        VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?)
                        """)) {
                    ps.setString(1, record.runId());
                    ps.setString(2, record.flowName());
                    ps.setDouble(3, record.startedAtMs() / 1000.0);
                    ps.setDouble(4, record.endedAtMs() / 1000.0);
                    ps.setDouble(5, record.durationMs() / 1000.0);
                    ps.setInt(6, record.succeeded() ? 1 : 0);
                    ps.setString(7, record.reason());
                    Double hitRate = hitRate(record.selectorOutcomes());
                    if (hitRate == null) {
                        ps.setNull(8, Types.REAL);
                    } else {
                        ps.setDouble(8, hitRate);
                    }
                    ps.setString(9, record.status().name());
                    ps.setString(10, record.trigger().name());
                    ps.setString(11, record.failedStepId());
                    ps.setString(12, record.error());
                    ps.setString(13, Jsons.toCompactJson(record.selectorOutcomes()));
                    ps.executeUpdate();
                }
                try (PreparedStatement ps = c.prepareStatement("""
                        INSERT INTO selector_stats(selector,success_count,failure_count) VALUES(?,?,?)
                        ON CONFLICT(selector) DO UPDATE SET
                            success_count=success_count+excluded.success_count,
                            failure_count=failure_count+excluded.failure_count
                        """)) {
                    for (SelectorOutcome outcome : record.selectorOutcomes()) {
                        ps.setString(1, outcome.selector());
                        ps.setInt(2, outcome.success() ? 1 : 0);
                        ps.setInt(3, outcome.success() ? 0 : 1);
                        ps.addBatch();
                    }
                    ps.executeBatch();
                }
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to store run record: " + record.runId(), e);
        }
    }

    public List<RunRecord> loadAll() {
        String sql = """
                SELECT run_id,flow_name,start_time,end_time,success,failure_reason,
                       status,run_trigger,failed_step_id,error,selector_outcomes
                FROM runs
                ORDER BY start_time ASC, id ASC
                """;
        List<RunRecord> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(toRecord(rs));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load run records", e);
        }
    }

    public Map<String, Double> selectorSuccessRates() {
        Map<String, Double> out = new LinkedHashMap<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT selector,success_count,failure_count FROM selector_stats ORDER BY selector");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                long ok = rs.getLong("success_count");
                long total = ok + rs.getLong("failure_count");
                out.put(rs.getString("selector"), total == 0L ? 0.0 : (double) ok / total);
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read selector stats", e);
        }
    }

    private static RunRecord toRecord(ResultSet rs) throws SQLException {
        String status = rs.getString("status");
        RunStatus runStatus = status == null
                ? (rs.getInt("success") == 1 ? RunStatus.SUCCESS : RunStatus.FAILED)
                : RunStatus.valueOf(status);
        String trigger = rs.getString("run_trigger");
        return new RunRecord(
                rs.getString("run_id"),
                rs.getString("flow_name"),
                trigger == null ? RunTrigger.MANUAL : RunTrigger.valueOf(trigger),
                Math.round(rs.getDouble("start_time") * 1000.0),
                Math.round(rs.getDouble("end_time") * 1000.0),
                runStatus,
                rs.getString("failed_step_id"),
                rs.getString("failure_reason"),
                rs.getString("error"),
                outcomes(rs.getString("selector_outcomes"))
        );
    }

    private static List<SelectorOutcome> outcomes(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        try {
            return Jsons.mapper().readValue(raw, OUTCOMES_TYPE);
        } catch (IOException e) {
            throw new RuntimeException("Corrupt selector_outcomes column: " + raw, e);
        }
    }

    private static Double hitRate(List<SelectorOutcome> outcomes) {
        if (outcomes.isEmpty()) {
            return null;
        }
        long ok = outcomes.stream().filter(SelectorOutcome::success).count();
        return (double) ok / outcomes.size();
    }
}
