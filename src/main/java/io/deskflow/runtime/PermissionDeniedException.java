package io.deskflow.runtime;

import io.deskflow.DeskFlowException;
import io.deskflow.model.FlowOperation;

public final class PermissionDeniedException extends DeskFlowException {
    private final String flowName;
    private final FlowOperation operation;
    private final String role;

    public PermissionDeniedException(String flowName, FlowOperation operation, String role) {
        super("permission_denied", "role '" + (role == null ? "" : role) + "' may not "
                + operation.key() + " flow '" + flowName + "'");
        this.flowName = flowName;
        this.operation = operation;
        this.role = role;
    }

    public String flowName() {
        return flowName;
    }

    public FlowOperation operation() {
        return operation;
    }

    public String role() {
        return role;
    }
}
