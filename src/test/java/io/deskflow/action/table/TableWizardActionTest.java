package io.deskflow.action.table;

import io.deskflow.action.ActionException;
import io.deskflow.action.ExecutionContext;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

final class TableWizardActionTest {
    private static final Map<String, Object> GRID = Map.of("automation_id", "customers");

    private final ExecutionContext context = new ExecutionContext("run-1", "table", Map.of());

    @Test
    void wizardWithSelectEqualsFindRowFollowedByRowSelect() {
        RecordingTable manualTable = new RecordingTable();
        FindRowAction manualFind = new FindRowAction(manualTable);
        RowSelectAction manualSelect = new RowSelectAction(manualTable);
        Object found = manualFind.execute(GRID, Map.of("query", "name=Alice"), context);
        Object manual = manualSelect.execute(GRID, Map.of("row", found), context);

        RecordingTable wizardTable = new RecordingTable();
        TableWizardAction wizard = new TableWizardAction(new FindRowAction(wizardTable), new RowSelectAction(wizardTable));
        Object viaWizard = wizard.execute(GRID, Map.of("query", "name=Alice", "select", true), context);

        Assertions.assertEquals(manual, viaWizard);
        Assertions.assertEquals(manualTable.selected, wizardTable.selected);
        Assertions.assertEquals(List.of(1), wizardTable.selected);
    }

    @Test
    void wizardWithoutSelectOnlyFinds() {
        RecordingTable table = new RecordingTable();
        TableWizardAction wizard = new TableWizardAction(new FindRowAction(table), new RowSelectAction(table));

        TableRow row = (TableRow) wizard.execute(GRID, Map.of("query", "city=Oslo&name=Carol"), context);

        Assertions.assertEquals(2, row.index());
        Assertions.assertTrue(table.selected.isEmpty());
    }

    @Test
    void findRowAcceptsCriteriaMapLooseParamsAndAll() {
        RecordingTable table = new RecordingTable();
        FindRowAction find = new FindRowAction(table);

        Assertions.assertEquals(0, ((TableRow) find.execute(GRID, Map.of("criteria", Map.of("name", "Bob")), context)).index());
        Assertions.assertEquals(1, ((TableRow) find.execute(GRID, Map.of("name", "Alice"), context)).index());
        Object oslo = find.execute(GRID, Map.of("query", "city=Oslo", "all", true), context);
        List<?> rows = Assertions.assertInstanceOf(List.class, oslo);
        Assertions.assertEquals(2, rows.size());
        Assertions.assertInstanceOf(TableRow.class, rows.get(0));
    }

    @Test
    void missingRowsAndBadQueriesFail() {
        RecordingTable table = new RecordingTable();
        TableWizardAction wizard = new TableWizardAction(new FindRowAction(table), new RowSelectAction(table));

        Assertions.assertEquals("row_not_found", Assertions.assertThrows(ActionException.class,
                () -> wizard.execute(GRID, Map.of("query", "name=Zed", "select", true), context)).reason());
        Assertions.assertEquals("invalid_params", Assertions.assertThrows(ActionException.class,
                () -> wizard.execute(GRID, Map.of("query", "Alice"), context)).reason());
        Assertions.assertEquals("row_not_found", Assertions.assertThrows(ActionException.class,
                () -> new RowSelectAction(table).execute(GRID, Map.of("row", 9), context)).reason());
        Assertions.assertTrue(table.selected.isEmpty());
    }

    @Test
    void rowSelectAcceptsIndexAndIndexMap() {
        RecordingTable table = new RecordingTable();
        RowSelectAction select = new RowSelectAction(table);

        select.execute(GRID, Map.of("row", 2), context);
        select.execute(GRID, Map.of("row", Map.of("index", 0)), context);

        Assertions.assertEquals(List.of(2, 0), table.selected);
    }

    private static final class RecordingTable implements TableBackend {
        private final List<TableRow> rows = List.of(
                new TableRow(0, Map.of("name", "Bob", "city", "Bergen")),
                new TableRow(1, Map.of("name", "Alice", "city", "Oslo")),
                new TableRow(2, Map.of("name", "Carol", "city", "Oslo"))
        );
        private final List<Integer> selected = new ArrayList<>();

        @Override
        public List<TableRow> rows(Map<String, Object> selector) {
            return rows;
        }

        @Override
        public void select(Map<String, Object> selector, TableRow row) {
            selected.add(row.index());
        }
    }
}
