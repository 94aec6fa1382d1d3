package io.deskflow.action;

import io.deskflow.DeskFlowException;

public class ActionException extends DeskFlowException {
    public ActionException(String reason, String message) {
        super(reason, message);
    }

    public ActionException(String reason, String message, Throwable cause) {
        super(reason, message, cause);
    }

    public static ActionException invalidParams(String action, String message) {
        return new ActionException("invalid_params", action + ": " + message);
    }

    public static ActionException notFound(String what) {
        return new ActionException("element_not_found", what + " not found");
    }

    public static ActionException timeout(String action, long timeoutMs) {
        return new ActionException("timeout", action + " timed out after " + timeoutMs + "ms");
    }

    public static ActionException backend(String action, Throwable cause) {
        return new ActionException("backend_error", action + " failed: " + cause.getMessage(), cause);
    }
}
