package io.deskflow.scheduler;

import java.nio.file.Path;
import java.time.LocalDateTime;

/**
 * Result of one due firing. {@code crashReport} is set only for FAILED firings
 * whose target threw.
 */
public record JobFiring(
        String jobId,
        LocalDateTime scheduledFor,
        JobOutcome outcome,
        long startedAtMs,
        long endedAtMs,
        String error,
        Path crashReport
) {
    static JobFiring skipped(String jobId, LocalDateTime scheduledFor, JobOutcome outcome) {
        long now = System.currentTimeMillis();
        return new JobFiring(jobId, scheduledFor, outcome, now, now, null, null);
    }
}
