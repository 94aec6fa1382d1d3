package io.deskflow.action;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Variables of one run. Not shared between runs and not thread-safe: steps of a
 * run execute on a single thread.
 *
 * <p>{@code session} holds backend state that actions keep across steps (an open
 * browser page, a selected table) and is never exposed as a variable.
 */
public final class ExecutionContext {
    private final String runId;
    private final String flowName;
    private final Map<String, Object> variables;
    private final Map<String, Object> session;

    public ExecutionContext(String runId, String flowName, Map<String, Object> initial) {
        this.runId = runId;
        this.flowName = flowName;
        this.variables = new LinkedHashMap<>();
        this.session = new LinkedHashMap<>();
        if (initial != null) {
            this.variables.putAll(initial);
        }
    }

    public String runId() {
        return runId;
    }

    public String flowName() {
        return flowName;
    }

    public boolean has(String name) {
        return variables.containsKey(name);
    }

    public Optional<Object> get(String name) {
        return Optional.ofNullable(variables.get(name));
    }

    public void set(String name, Object value) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("variable name cannot be empty");
        }
        variables.put(name, value);
    }

    public Map<String, Object> variables() {
        return Collections.unmodifiableMap(variables);
    }

    public <T> T session(String key, Class<T> type) {
        Object value = session.get(key);
        return type.isInstance(value) ? type.cast(value) : null;
    }

    public void putSession(String key, Object value) {
        session.put(key, value);
    }
}
