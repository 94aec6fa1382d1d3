package io.deskflow.action.table;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Column predicates, all of which must hold. Text form is
 * {@code column=value} pairs joined by {@code ;} or {@code &}.
 */
public final class TableQuery {
    private final Map<String, String> criteria;

    private TableQuery(Map<String, String> criteria) {
        this.criteria = Collections.unmodifiableMap(criteria);
    }

    public static TableQuery parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("query cannot be empty");
        }
        Map<String, String> out = new LinkedHashMap<>();
        for (String part : text.split("[;&]")) {
            String trimmed = part.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int eq = trimmed.indexOf('=');
            if (eq <= 0) {
                throw new IllegalArgumentException("expected column=value, got: " + trimmed);
            }
            out.put(trimmed.substring(0, eq).trim(), trimmed.substring(eq + 1).trim());
        }
        if (out.isEmpty()) {
            throw new IllegalArgumentException("query has no predicates: " + text);
        }
        return new TableQuery(out);
    }

    public static TableQuery of(Map<String, ?> criteria) {
        Map<String, String> out = new LinkedHashMap<>();
        criteria.forEach((column, value) -> out.put(column, value == null ? null : String.valueOf(value)));
        return new TableQuery(out);
    }

    public Map<String, String> criteria() {
        return criteria;
    }

    public boolean isEmpty() {
        return criteria.isEmpty();
    }

    public boolean matches(TableRow row) {
        for (Map.Entry<String, String> entry : criteria.entrySet()) {
            if (!Objects.equals(entry.getValue(), row.cell(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return criteria.toString();
    }
}
