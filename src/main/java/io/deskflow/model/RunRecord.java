package io.deskflow.model;

import java.util.List;

public record RunRecord(
        String runId,
        String flowName,
        RunTrigger trigger,
        long startedAtMs,
        long endedAtMs,
        RunStatus status,
        String failedStepId,
        String reason,
        String error,
        List<SelectorOutcome> selectorOutcomes
) {
    public RunRecord {
        trigger = trigger == null ? RunTrigger.MANUAL : trigger;
        selectorOutcomes = selectorOutcomes == null ? List.of() : List.copyOf(selectorOutcomes);
    }

    public static RunRecord success(
            String runId,
            String flowName,
            RunTrigger trigger,
            long startedAtMs,
            long endedAtMs,
            List<SelectorOutcome> selectorOutcomes
    ) {
        return new RunRecord(runId, flowName, trigger, startedAtMs, endedAtMs,
                RunStatus.SUCCESS, null, null, null, selectorOutcomes);
    }

    public static RunRecord failed(
            String runId,
            String flowName,
            RunTrigger trigger,
            long startedAtMs,
            long endedAtMs,
            String failedStepId,
            String reason,
            String error,
            List<SelectorOutcome> selectorOutcomes
    ) {
        return new RunRecord(runId, flowName, trigger, startedAtMs, endedAtMs,
                RunStatus.FAILED, failedStepId, reason, error, selectorOutcomes);
    }

    public long durationMs() {
        return Math.max(0L, endedAtMs - startedAtMs);
    }

    public boolean succeeded() {
        return status == RunStatus.SUCCESS;
    }
}
