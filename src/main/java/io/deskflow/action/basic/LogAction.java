package io.deskflow.action.basic;

import io.deskflow.action.Action;
import io.deskflow.action.ActionParams;
import io.deskflow.action.ExecutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

public final class LogAction implements Action {
    private static final Logger log = LoggerFactory.getLogger(LogAction.class);

    @Override
    public String name() {
        return "log";
    }

    @Override
    public Object execute(Map<String, Object> selector, Map<String, Object> params, ExecutionContext context) {
        String message = ActionParams.of(name(), params).string("message", "");
        log.info("[{}] {}", context.runId(), message);
        return message;
    }
}
