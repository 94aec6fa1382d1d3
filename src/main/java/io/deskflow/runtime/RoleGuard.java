package io.deskflow.runtime;

import io.deskflow.config.RuntimeSettings.MissingRoleKeyPolicy;
import io.deskflow.model.Flow;
import io.deskflow.model.FlowOperation;

import java.util.Optional;
import java.util.Set;

/**
 * Checks an actor role against a flow's role map.
 *
 * <ul>
 *   <li>No role map at all: every operation is allowed.</li>
 *   <li>Operation listed: the role must be in its set (an empty set denies all).</li>
 *   <li>Operation not listed: decided by {@link MissingRoleKeyPolicy}.</li>
 * </ul>
 */
public final class RoleGuard {
    private final MissingRoleKeyPolicy missingKeyPolicy;

    public RoleGuard(MissingRoleKeyPolicy missingKeyPolicy) {
        this.missingKeyPolicy = missingKeyPolicy == null ? MissingRoleKeyPolicy.DENY : missingKeyPolicy;
    }

    public boolean isAllowed(Flow flow, FlowOperation operation, String role) {
        if (flow.roles().isEmpty()) {
            return true;
        }
        Optional<Set<String>> allowed = flow.rolesFor(operation);
        if (allowed.isEmpty()) {
            return missingKeyPolicy == MissingRoleKeyPolicy.ALLOW;
        }
        return role != null && allowed.get().contains(role.trim());
    }

    public void check(Flow flow, FlowOperation operation, String role) {
        if (!isAllowed(flow, operation, role)) {
            throw new PermissionDeniedException(flow.name(), operation, role);
        }
    }
}
