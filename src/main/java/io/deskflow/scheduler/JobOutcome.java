package io.deskflow.scheduler;

public enum JobOutcome {
    COMPLETED,
    FAILED,
    SKIPPED_CONDITION,
    SKIPPED_OVERLAP
}
