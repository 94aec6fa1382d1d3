package io.deskflow.scheduler;

import java.time.LocalDateTime;
import java.util.Map;

public record JobStatus(
        String id,
        String cron,
        String lockPath,
        LocalDateTime nextFire,
        JobFiring lastFiring,
        Map<JobOutcome, Long> counts
) {
}
