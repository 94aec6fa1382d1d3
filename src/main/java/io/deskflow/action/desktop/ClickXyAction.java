package io.deskflow.action.desktop;

import io.deskflow.action.Action;
import io.deskflow.action.ActionParams;
import io.deskflow.action.ExecutionContext;

import java.util.Map;

/**
 * Clicks at {@code (x, y)} given in {@code basis}. With {@code preview=true} the
 * screen position is resolved and returned but nothing is clicked.
 */
public final class ClickXyAction implements Action {
    private final PointerDevice pointer;
    private final CoordinateResolver resolver;

    public ClickXyAction(PointerDevice pointer, CoordinateResolver resolver) {
        this.pointer = pointer;
        this.resolver = resolver;
    }

    @Override
    public String name() {
        return "click_xy";
    }

    @Override
    public Object execute(Map<String, Object> selector, Map<String, Object> params, ExecutionContext context) {
        ActionParams p = ActionParams.of(name(), params);
        Point relative = new Point(p.requireInt("x"), p.requireInt("y"));
        Basis basis = Basis.from(p);
        boolean preview = p.bool("preview", false);
        Point screen = resolver.toScreen(basis, relative, selector);
        if (!preview) {
            pointer.click(screen);
        }
        return new Coordinate(screen, relative, basis, pointer.dpi(), preview);
    }
}
