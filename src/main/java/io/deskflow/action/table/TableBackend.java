package io.deskflow.action.table;

import java.util.List;
import java.util.Map;

/**
 * Access to a data grid on screen. The selector identifies the grid control.
 */
public interface TableBackend {
    List<TableRow> rows(Map<String, Object> selector);

    /**
     * Scrolls {@code row} into view if needed and selects it.
     */
    void select(Map<String, Object> selector, TableRow row);
}
