package io.deskflow.model;

/**
 * What the runner does when a step fails.
 *
 * <p>{@code recover} runs after every failed attempt, before the next retry;
 * {@code screenshot} captures the screen once the step has failed for good;
 * {@code continueRun} moves on to the next step instead of failing the run.
 */
public record OnError(boolean continueRun, Step recover, boolean screenshot) {
    public static final OnError NONE = new OnError(false, null, false);

    public boolean isEmpty() {
        return !continueRun && recover == null && !screenshot;
    }
}
