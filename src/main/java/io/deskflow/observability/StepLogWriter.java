package io.deskflow.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.deskflow.security.SensitiveDataMasker;
import io.deskflow.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-run {@code log.jsonl}: one line per executed step. Write failures are logged
 * and do not fail the run.
 */
public final class StepLogWriter {
    private static final Logger log = LoggerFactory.getLogger(StepLogWriter.class);
    public static final String FILE_NAME = "log.jsonl";

    private final Path file;

    public StepLogWriter(Path runDir) {
        this.file = runDir.resolve(FILE_NAME);
    }

    public Path file() {
        return file;
    }

    public void stepSucceeded(String runId, String stepId, String action, Map<String, Object> params,
                              long durationMs, Object result) {
        Map<String, Object> row = row(runId, stepId, action, params, durationMs);
        row.put("status", "ok");
        row.put("result", printable(result));
        append(row);
    }

    public void stepFailed(String runId, String stepId, String action, Map<String, Object> params,
                           long durationMs, String reason, String error) {
        Map<String, Object> row = row(runId, stepId, action, params, durationMs);
        row.put("status", "error");
        row.put("reason", reason);
        row.put("error", error);
        append(row);
    }

    public void stepSkipped(String runId, String stepId, String action, Map<String, Object> params) {
        Map<String, Object> row = row(runId, stepId, action, params, 0L);
        row.put("status", "skipped");
        append(row);
    }

    private static Map<String, Object> row(String runId, String stepId, String action, Map<String, Object> params,
                                           long durationMs) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("ts", Instant.now().toString());
        row.put("run_id", runId);
        row.put("step_id", stepId);
        row.put("action", action);
        row.put("duration_ms", durationMs);
        row.put("params", SensitiveDataMasker.masked(params));
        return row;
    }

    private static Object printable(Object result) {
        if (result == null || result instanceof Number || result instanceof Boolean) {
            return result;
        }
        if (result instanceof byte[] bytes) {
            return bytes.length + " bytes";
        }
        try {
            JsonNode tree = Jsons.mapper().valueToTree(result);
            return SensitiveDataMasker.maskedTree(tree);
        } catch (IllegalArgumentException e) {
            return String.valueOf(result);
        }
    }

    private void append(Map<String, Object> row) {
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, Jsons.toCompactJson(row) + System.lineSeparator(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to append step log {}: {}", file, e.getMessage());
        }
    }
}
