package io.deskflow.action;

import io.deskflow.DeskFlowException;

public final class UnknownActionException extends DeskFlowException {
    private final String actionName;

    public UnknownActionException(String actionName) {
        super("unknown_action", "Unknown action: " + actionName);
        this.actionName = actionName;
    }

    public String actionName() {
        return actionName;
    }
}
