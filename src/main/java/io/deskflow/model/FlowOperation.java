package io.deskflow.model;

import java.util.Locale;

public enum FlowOperation {
    VIEW("view"),
    EDIT("edit"),
    PUBLISH("publish"),
    APPROVE("approve"),
    RUN("run");

    private final String key;

    FlowOperation(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static FlowOperation fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Flow operation cannot be empty");
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        for (FlowOperation op : values()) {
            if (op.key.equals(value)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown flow operation: " + raw);
    }
}
