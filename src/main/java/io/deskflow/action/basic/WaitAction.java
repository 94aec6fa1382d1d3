package io.deskflow.action.basic;

import io.deskflow.action.Action;
import io.deskflow.action.ActionException;
import io.deskflow.action.ActionParams;
import io.deskflow.action.ExecutionContext;

import java.util.Map;

public final class WaitAction implements Action {
    private static final long DEFAULT_MS = 1_000L;

    @Override
    public String name() {
        return "wait";
    }

    @Override
    public Object execute(Map<String, Object> selector, Map<String, Object> params, ExecutionContext context) {
        long ms = ActionParams.of(name(), params).longValue("ms", DEFAULT_MS);
        if (ms < 0L) {
            throw ActionException.invalidParams(name(), "'ms' cannot be negative");
        }
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ActionException("interrupted", "wait interrupted", e);
        }
        return ms;
    }
}
