package io.deskflow.model;

/**
 * Flow-wide fallbacks for steps that do not set their own {@code retry} or
 * {@code timeoutMs}. A null field means no retry and no time limit.
 */
public record StepDefaults(Integer retry, Long timeoutMs) {
    public static final StepDefaults NONE = new StepDefaults(null, null);

    public StepDefaults {
        Step.checkRetry(retry, "defaults");
        Step.checkTimeout(timeoutMs, "defaults");
    }
}
