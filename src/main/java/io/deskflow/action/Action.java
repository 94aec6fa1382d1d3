package io.deskflow.action;

import java.util.Map;

/**
 * A named automation primitive. Implementations signal failure by throwing
 * {@link ActionException}; anything else escaping {@code execute} is reported
 * as an internal error of the run.
 */
public interface Action {
    String name();

    Object execute(Map<String, Object> selector, Map<String, Object> params, ExecutionContext context);
}
