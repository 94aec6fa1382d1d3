package io.deskflow.action.desktop;

import io.deskflow.action.Action;
import io.deskflow.action.ActionParams;
import io.deskflow.action.ExecutionContext;

import java.util.Map;

/**
 * Reads the pointer position and expresses it in {@code basis}. Unless
 * {@code preview=true} the result is also recorded in the {@link CaptureStore}.
 */
public final class CaptureCoordinatesAction implements Action {
    private final PointerDevice pointer;
    private final CoordinateResolver resolver;
    private final CaptureStore store;

    public CaptureCoordinatesAction(PointerDevice pointer, CoordinateResolver resolver, CaptureStore store) {
        this.pointer = pointer;
        this.resolver = resolver;
        this.store = store;
    }

    @Override
    public String name() {
        return "capture_coordinates";
    }

    @Override
    public Object execute(Map<String, Object> selector, Map<String, Object> params, ExecutionContext context) {
        ActionParams p = ActionParams.of(name(), params);
        Basis basis = Basis.from(p);
        boolean preview = p.bool("preview", false);
        Point screen = pointer.position();
        Point relative = resolver.fromScreen(basis, screen, selector);
        Coordinate coordinate = new Coordinate(screen, relative, basis, pointer.dpi(), preview);
        if (!preview) {
            store.add(coordinate);
        }
        return coordinate;
    }
}
