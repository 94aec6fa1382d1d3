package io.deskflow.action.desktop;

import io.deskflow.action.ActionException;

import java.util.Map;

public final class CoordinateResolver {
    private final DesktopLocator locator;

    public CoordinateResolver(DesktopLocator locator) {
        this.locator = locator;
    }

    public Point origin(Basis basis, Map<String, Object> selector) {
        return switch (basis) {
            case SCREEN -> Point.ORIGIN;
            case ELEMENT -> locator.elementBounds(selector)
                    .map(Bounds::origin)
                    .orElseThrow(() -> ActionException.notFound("element for basis Element"));
            case WINDOW -> locator.windowBounds(selector)
                    .map(Bounds::origin)
                    .orElseThrow(() -> ActionException.notFound("window for basis Window"));
        };
    }

    public Point toScreen(Basis basis, Point relative, Map<String, Object> selector) {
        return relative.plus(origin(basis, selector));
    }

    public Point fromScreen(Basis basis, Point screen, Map<String, Object> selector) {
        return screen.minus(origin(basis, selector));
    }
}
