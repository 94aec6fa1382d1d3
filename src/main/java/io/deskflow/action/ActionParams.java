package io.deskflow.action;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Typed accessors over a step's parameter map. Values come from JSON, so numbers
 * may arrive as any {@link Number} or as numeric strings.
 */
public final class ActionParams {
    private final String action;
    private final Map<String, Object> values;

    private ActionParams(String action, Map<String, Object> values) {
        this.action = action;
        this.values = values == null ? Map.of() : values;
    }

    public static ActionParams of(String action, Map<String, Object> values) {
        return new ActionParams(action, values);
    }

    public String action() {
        return action;
    }

    public boolean has(String key) {
        return values.get(key) != null;
    }

    public Object raw(String key) {
        return values.get(key);
    }

    public String requireString(String key) {
        String value = string(key, null);
        if (value == null || value.isBlank()) {
            throw ActionException.invalidParams(action, "missing '" + key + "'");
        }
        return value;
    }

    public String string(String key, String fallback) {
        Object value = values.get(key);
        return value == null ? fallback : String.valueOf(value);
    }

    public long longValue(String key, long fallback) {
        Object value = values.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        try {
            return Long.parseLong(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw ActionException.invalidParams(action, "'" + key + "' must be an integer");
        }
    }

    public int requireInt(String key) {
        if (!has(key)) {
            throw ActionException.invalidParams(action, "missing '" + key + "'");
        }
        return (int) longValue(key, 0L);
    }

    public double doubleValue(String key, double fallback) {
        Object value = values.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw ActionException.invalidParams(action, "'" + key + "' must be a number");
        }
    }

    public boolean bool(String key, boolean fallback) {
        Object value = values.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        String text = String.valueOf(value).trim().toLowerCase(Locale.ROOT);
        return "true".equals(text) || "yes".equals(text) || "1".equals(text);
    }

    public List<String> stringList(String key) {
        Object value = values.get(key);
        List<String> out = new ArrayList<>();
        if (value instanceof Iterable<?> items) {
            for (Object item : items) {
                if (item != null) {
                    out.add(String.valueOf(item));
                }
            }
        } else if (value != null) {
            out.add(String.valueOf(value));
        }
        return out;
    }
}
