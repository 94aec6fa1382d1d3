package io.deskflow.action.table;

import io.deskflow.action.Action;
import io.deskflow.action.ActionException;
import io.deskflow.action.ActionParams;
import io.deskflow.action.ExecutionContext;

import java.util.List;
import java.util.Map;

/**
 * Selects a row. {@code row} may be a {@link TableRow} bound by an earlier step, a
 * row index, or a map carrying {@code index}.
 */
public final class RowSelectAction implements Action {
    public static final String NAME = "table.row.select";

    private final TableBackend backend;

    public RowSelectAction(TableBackend backend) {
        this.backend = backend;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Object execute(Map<String, Object> selector, Map<String, Object> params, ExecutionContext context) {
        ActionParams p = ActionParams.of(name(), params);
        Object raw = p.has("row") ? p.raw("row") : p.raw("index");
        if (raw == null) {
            throw ActionException.invalidParams(name(), "missing 'row'");
        }
        try {
            TableRow row = raw instanceof TableRow given ? given : byIndex(selector, indexOf(raw));
            backend.select(selector, row);
            return row;
        } catch (ActionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw ActionException.backend(name(), e);
        }
    }

    private TableRow byIndex(Map<String, Object> selector, int index) {
        List<TableRow> rows = backend.rows(selector);
        for (TableRow row : rows) {
            if (row.index() == index) {
                return row;
            }
        }
        throw new ActionException("row_not_found", "no row with index " + index);
    }

    private int indexOf(Object raw) {
        Object value = raw instanceof Map<?, ?> map ? map.get("index") : raw;
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw ActionException.invalidParams(name(), "'row' must be a row or an index");
        }
    }
}
