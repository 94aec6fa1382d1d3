package io.deskflow.action.table;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record TableRow(int index, Map<String, Object> cells) {
    public TableRow {
        if (index < 0) {
            throw new IllegalArgumentException("row index cannot be negative");
        }
        cells = cells == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(cells));
    }

    public String cell(String column) {
        Object value = cells.get(column);
        return value == null ? null : String.valueOf(value);
    }
}
