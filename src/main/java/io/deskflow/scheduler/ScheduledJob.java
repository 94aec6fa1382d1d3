package io.deskflow.scheduler;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.BooleanSupplier;

/**
 * A target fired on a cron schedule under its own lock. {@code logFile}, when set,
 * is tailed into crash reports.
 */
public record ScheduledJob(
        String id,
        CronExpression cron,
        Callable<?> target,
        Path lockPath,
        List<BooleanSupplier> conditions,
        Path logFile
) {
    public ScheduledJob {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("job id cannot be empty");
        }
        if (cron == null || target == null || lockPath == null) {
            throw new IllegalArgumentException("job " + id + " needs a cron expression, a target and a lock path");
        }
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }
}
