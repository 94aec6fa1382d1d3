package io.deskflow.action.table;

import io.deskflow.action.Action;
import io.deskflow.action.ActionException;
import io.deskflow.action.ActionParams;
import io.deskflow.action.ExecutionContext;

import java.util.Map;

/**
 * {@code find_row} followed by an optional {@code row.select}, driven by a
 * {@code column=value} query. Delegates to the same action instances a flow would
 * chain by hand.
 */
public final class TableWizardAction implements Action {
    private final Action findRow;
    private final Action rowSelect;

    public TableWizardAction(Action findRow, Action rowSelect) {
        this.findRow = findRow;
        this.rowSelect = rowSelect;
    }

    @Override
    public String name() {
        return "table.wizard";
    }

    @Override
    public Object execute(Map<String, Object> selector, Map<String, Object> params, ExecutionContext context) {
        ActionParams p = ActionParams.of(name(), params);
        TableQuery query;
        try {
            query = TableQuery.parse(p.requireString("query"));
        } catch (IllegalArgumentException e) {
            throw ActionException.invalidParams(name(), e.getMessage());
        }
        Object row = findRow.execute(selector, Map.of("criteria", query.criteria()), context);
        if (!p.bool("select", false)) {
            return row;
        }
        return rowSelect.execute(selector, Map.of("row", row), context);
    }
}
