package io.deskflow.action;

import io.deskflow.model.Step;
import io.deskflow.util.Jsons;

import java.util.Map;
import java.util.Optional;

/**
 * Resolves a step's handler, substitutes run variables into its selector and
 * params, invokes it and binds the result to the step's output variable.
 */
public final class ActionDispatcher {
    private final ActionRegistry registry;

    public ActionDispatcher(ActionRegistry registry) {
        this.registry = registry;
    }

    public ActionRegistry registry() {
        return registry;
    }

    public Object dispatch(Step step, ExecutionContext context) {
        Object result = invoke(step, context);
        bindOutput(step, result, context);
        return result;
    }

    /**
     * Runs the step's action without binding its output variable.
     */
    public Object invoke(Step step, ExecutionContext context) {
        Action action = registry.resolve(step.action());
        Map<String, Object> selector = VariableResolver.resolveMap(step.selector(), context);
        Map<String, Object> params = VariableResolver.resolveMap(step.params(), context);
        return action.execute(selector, params, context);
    }

    public void bindOutput(Step step, Object result, ExecutionContext context) {
        if (step.out() != null) {
            context.set(step.out(), result);
        }
    }

    /**
     * Stable key identifying the locator a step targets, used for per-selector
     * statistics. Uses the unresolved document form so runs with different
     * variable values aggregate under one key.
     */
    public static Optional<String> selectorKey(Step step) {
        if (!step.selector().isEmpty()) {
            return Optional.of(Jsons.toCompactJson(step.selector()));
        }
        Object inline = step.params().get("selector");
        if (inline != null && !String.valueOf(inline).isBlank()) {
            return Optional.of(String.valueOf(inline));
        }
        return Optional.empty();
    }
}
