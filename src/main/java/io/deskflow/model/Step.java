package io.deskflow.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One action of a flow. {@code retry} and {@code timeoutMs} are null when the
 * step falls back to the flow's {@link StepDefaults}.
 */
public record Step(
        String id,
        String action,
        Map<String, Object> selector,
        Map<String, Object> params,
        String out,
        Integer retry,
        Long timeoutMs,
        OnError onError
) {
    public Step {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("step id cannot be empty");
        }
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("step action cannot be empty: " + id);
        }
        checkRetry(retry, id);
        checkTimeout(timeoutMs, id);
        selector = selector == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(selector));
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
        out = out == null || out.isBlank() ? null : out.trim();
        onError = onError == null ? OnError.NONE : onError;
    }

    public Step(String id, String action, Map<String, Object> selector, Map<String, Object> params, String out) {
        this(id, action, selector, params, out, null, null, OnError.NONE);
    }

    public static Step of(String id, String action, Map<String, Object> params) {
        return new Step(id, action, Map.of(), params, null);
    }

    public Step withOut(String variable) {
        return new Step(id, action, selector, params, variable, retry, timeoutMs, onError);
    }

    public Step withSelector(Map<String, Object> value) {
        return new Step(id, action, value, params, out, retry, timeoutMs, onError);
    }

    public Step withRetry(Integer value) {
        return new Step(id, action, selector, params, out, value, timeoutMs, onError);
    }

    public Step withTimeoutMs(Long value) {
        return new Step(id, action, selector, params, out, retry, value, onError);
    }

    public Step withOnError(OnError value) {
        return new Step(id, action, selector, params, out, retry, timeoutMs, value);
    }

    public int effectiveRetry(StepDefaults defaults) {
        if (retry != null) {
            return retry;
        }
        return defaults == null || defaults.retry() == null ? 0 : defaults.retry();
    }

    public Long effectiveTimeoutMs(StepDefaults defaults) {
        if (timeoutMs != null) {
            return timeoutMs;
        }
        return defaults == null ? null : defaults.timeoutMs();
    }

    static void checkRetry(Integer retry, String owner) {
        if (retry != null && retry < 0) {
            throw new IllegalArgumentException("retry cannot be negative: " + owner);
        }
    }

    static void checkTimeout(Long timeoutMs, String owner) {
        if (timeoutMs != null && timeoutMs <= 0L) {
            throw new IllegalArgumentException("timeoutMs must be positive: " + owner);
        }
    }
}
