package io.deskflow.action.web;

import io.deskflow.action.ActionException;
import io.deskflow.action.ActionParams;

public record WaitCondition(
        Kind kind,
        String value,
        String frame
) {
    public enum Kind {
        SELECTOR,
        ENABLED,
        LOAD_STATE,
        NETWORK_IDLE,
        URL,
        RESPONSE,
        EXPRESSION
    }

    static WaitCondition fromParams(ActionParams params) {
        String frame = params.string("frame", null);
        String preset = params.string("preset", "");
        WaitCondition fromPreset = switch (preset) {
            case "networkidle" -> new WaitCondition(Kind.NETWORK_IDLE, "networkidle", frame);
            case "url" -> new WaitCondition(Kind.URL, params.requireString("url"), frame);
            case "enabled" -> new WaitCondition(Kind.ENABLED, params.requireString("selector"), frame);
            case "response" -> new WaitCondition(Kind.RESPONSE, params.requireString("url"), frame);
            case "" -> null;
            default -> throw ActionException.invalidParams("wait_for", "unknown preset '" + preset + "'");
        };
        if (fromPreset != null) {
            return fromPreset;
        }
        if (params.has("selector")) {
            return new WaitCondition(Kind.SELECTOR, params.requireString("selector"), frame);
        }
        if (params.has("state")) {
            return new WaitCondition(Kind.LOAD_STATE, params.requireString("state"), frame);
        }
        if (params.has("url")) {
            return new WaitCondition(Kind.URL, params.requireString("url"), frame);
        }
        if (params.has("expr") || params.has("script")) {
            String expr = params.string("expr", params.string("script", null));
            return new WaitCondition(Kind.EXPRESSION, expr, frame);
        }
        throw ActionException.invalidParams("wait_for", "no wait condition specified");
    }
}
