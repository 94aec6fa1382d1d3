package io.deskflow.config;

import com.fasterxml.jackson.databind.JsonNode;
import io.deskflow.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Tunables read from {@code deskflow-settings.json}. Missing or invalid fields fall
 * back to their defaults, so a partial or absent file is always usable.
 */
public record RuntimeSettings(
        long staleLockMs,
        long schedulerPollMs,
        int schedulerWorkers,
        MissingRoleKeyPolicy missingRoleKeyPolicy,
        List<JobSettings> jobs
) {
    private static final Logger log = LoggerFactory.getLogger(RuntimeSettings.class);

    public static final long DEFAULT_STALE_LOCK_MS = 0L;
    public static final long DEFAULT_SCHEDULER_POLL_MS = 200L;
    public static final int DEFAULT_SCHEDULER_WORKERS = 2;

    public enum MissingRoleKeyPolicy {
        DENY,
        ALLOW;

        public static MissingRoleKeyPolicy fromString(String raw) {
            if (raw == null || raw.isBlank()) {
                return DENY;
            }
            return "allow".equals(raw.trim().toLowerCase(Locale.ROOT)) ? ALLOW : DENY;
        }
    }

    /**
     * A scheduled flow: {@code conditions} names built-in predicates, optionally
     * prefixed with {@code !} for negation.
     */
    public record JobSettings(
            String id,
            String cron,
            String flow,
            String role,
            String lock,
            List<String> conditions
    ) {
        public JobSettings {
            conditions = conditions == null ? List.of() : List.copyOf(conditions);
        }
    }

    public RuntimeSettings {
        staleLockMs = Math.max(0L, staleLockMs);
        schedulerPollMs = schedulerPollMs <= 0L ? DEFAULT_SCHEDULER_POLL_MS : schedulerPollMs;
        schedulerWorkers = schedulerWorkers <= 0 ? DEFAULT_SCHEDULER_WORKERS : schedulerWorkers;
        missingRoleKeyPolicy = missingRoleKeyPolicy == null ? MissingRoleKeyPolicy.DENY : missingRoleKeyPolicy;
        jobs = jobs == null ? List.of() : List.copyOf(jobs);
    }

    public static RuntimeSettings defaults() {
        return new RuntimeSettings(DEFAULT_STALE_LOCK_MS, DEFAULT_SCHEDULER_POLL_MS, DEFAULT_SCHEDULER_WORKERS,
                MissingRoleKeyPolicy.DENY, List.of());
    }

    public static RuntimeSettings load(Path file) {
        if (!Files.exists(file)) {
            return defaults();
        }
        JsonNode root;
        try {
            root = Jsons.mapper().readTree(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.warn("Ignoring unreadable settings file {}: {}", file, e.getMessage());
            return defaults();
        }
        if (root == null || !root.isObject()) {
            log.warn("Ignoring settings file {}: not a JSON object", file);
            return defaults();
        }
        return new RuntimeSettings(
                longField(root, "staleLockMs", DEFAULT_STALE_LOCK_MS),
                longField(root, "schedulerPollMs", DEFAULT_SCHEDULER_POLL_MS),
                (int) longField(root, "schedulerWorkers", DEFAULT_SCHEDULER_WORKERS),
                MissingRoleKeyPolicy.fromString(root.path("missingRoleKeyPolicy").asText(null)),
                parseJobs(root.path("jobs"))
        );
    }

    public void save(Path file) {
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            Files.writeString(file, Jsons.toJson(this), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write settings file: " + file, e);
        }
    }

    private static long longField(JsonNode root, String field, long fallback) {
        JsonNode node = root.path(field);
        if (node.isNumber()) {
            return node.asLong();
        }
        if (node.isTextual()) {
            try {
                return Long.parseLong(node.asText().trim());
            } catch (NumberFormatException e) {
                log.warn("Invalid value for {}: {}", field, node.asText());
            }
        }
        return fallback;
    }

    private static List<JobSettings> parseJobs(JsonNode node) {
        List<JobSettings> out = new ArrayList<>();
        if (!node.isArray()) {
            return out;
        }
        for (JsonNode job : node) {
            String id = job.path("id").asText("");
            String cron = job.path("cron").asText("");
            String flow = job.path("flow").asText("");
            if (id.isBlank() || cron.isBlank() || flow.isBlank()) {
                log.warn("Skipping job entry without id, cron or flow: {}", job);
                continue;
            }
            List<String> conditions = new ArrayList<>();
            for (JsonNode condition : job.path("conditions")) {
                String name = condition.asText("").trim();
                if (!name.isEmpty()) {
                    conditions.add(name);
                }
            }
            out.add(new JobSettings(
                    id,
                    cron,
                    flow,
                    job.path("role").asText(null),
                    job.path("lock").asText(null),
                    conditions
            ));
        }
        return out;
    }
}
