package io.deskflow;

/**
 * Base type of every domain failure the runtime reports to callers.
 *
 * <p>{@link #reason()} is a short machine-readable category (for example
 * {@code lock_busy} or {@code element_not_found}); it ends up in
 * {@link io.deskflow.model.RunRecord#reason()} and in the failure-reason
 * aggregates.
 */
public class DeskFlowException extends RuntimeException {
    private final String reason;

    public DeskFlowException(String reason, String message) {
        super(message);
        this.reason = reason;
    }

    public DeskFlowException(String reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public String reason() {
        return reason;
    }
}
