package io.deskflow.action.basic;

import io.deskflow.action.Action;
import io.deskflow.action.ActionParams;
import io.deskflow.action.ExecutionContext;

import java.util.Map;

/**
 * Assigns {@code value} (already placeholder-substituted) to variable {@code name}.
 */
public final class SetVariableAction implements Action {
    @Override
    public String name() {
        return "set";
    }

    @Override
    public Object execute(Map<String, Object> selector, Map<String, Object> params, ExecutionContext context) {
        ActionParams p = ActionParams.of(name(), params);
        String variable = p.requireString("name");
        Object value = p.raw("value");
        context.set(variable, value);
        return value;
    }
}
