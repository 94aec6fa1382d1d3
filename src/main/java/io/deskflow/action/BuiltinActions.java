package io.deskflow.action;

import io.deskflow.action.basic.LogAction;
import io.deskflow.action.basic.SetVariableAction;
import io.deskflow.action.basic.WaitAction;
import io.deskflow.action.desktop.CaptureCoordinatesAction;
import io.deskflow.action.desktop.CaptureStore;
import io.deskflow.action.desktop.ClickXyAction;
import io.deskflow.action.desktop.CoordinateResolver;
import io.deskflow.action.image.FindImageAction;
import io.deskflow.action.table.FindRowAction;
import io.deskflow.action.table.RowSelectAction;
import io.deskflow.action.table.TableWizardAction;
import io.deskflow.action.web.WebAction;

/**
 * Registers the built-in action families, grouped by category.
 */
public final class BuiltinActions {
    public static final String BASIC = "basic";
    public static final String WEB = "web";
    public static final String IMAGE = "image";
    public static final String DESKTOP = "desktop";
    public static final String TABLE = "table";

    private BuiltinActions() {
    }

    public static ActionRegistry install(ActionRegistry registry, ActionBackends backends, CaptureStore captures) {
        registry.register(BASIC, new LogAction());
        registry.register(BASIC, new SetVariableAction());
        registry.register(BASIC, new WaitAction());

        for (WebAction action : WebAction.all(backends.browser(), backends.screenshotMask())) {
            registry.register(WEB, action);
        }

        CoordinateResolver resolver = new CoordinateResolver(backends.desktopLocator());
        registry.register(IMAGE, new FindImageAction(backends.imageMatcher(), backends.pointer(), resolver));
        registry.register(DESKTOP, new ClickXyAction(backends.pointer(), resolver));
        registry.register(DESKTOP, new CaptureCoordinatesAction(backends.pointer(), resolver, captures));

        FindRowAction findRow = new FindRowAction(backends.table());
        RowSelectAction rowSelect = new RowSelectAction(backends.table());
        registry.register(TABLE, findRow);
        registry.register(TABLE, "find_row", findRow);
        registry.register(TABLE, rowSelect);
        registry.register(TABLE, "row.select", rowSelect);
        registry.register(TABLE, new TableWizardAction(findRow, rowSelect));
        return registry;
    }
}
