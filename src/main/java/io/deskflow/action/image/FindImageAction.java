package io.deskflow.action.image;

import io.deskflow.action.Action;
import io.deskflow.action.ActionException;
import io.deskflow.action.ActionParams;
import io.deskflow.action.ExecutionContext;
import io.deskflow.action.desktop.Basis;
import io.deskflow.action.desktop.Bounds;
import io.deskflow.action.desktop.Coordinate;
import io.deskflow.action.desktop.CoordinateResolver;
import io.deskflow.action.desktop.Point;
import io.deskflow.action.desktop.PointerDevice;

import java.util.Map;
import java.util.Optional;

/**
 * Searches the screen for a template image until {@code timeout} elapses. The
 * match is returned relative to {@code basis}; with {@code click=true} the pointer
 * clicks it unless {@code preview=true}.
 */
public final class FindImageAction implements Action {
    private static final long DEFAULT_TIMEOUT_MS = 3_000L;
    private static final long DEFAULT_INTERVAL_MS = 250L;

    private final ImageMatcher matcher;
    private final PointerDevice pointer;
    private final CoordinateResolver resolver;

    public FindImageAction(ImageMatcher matcher, PointerDevice pointer, CoordinateResolver resolver) {
        this.matcher = matcher;
        this.pointer = pointer;
        this.resolver = resolver;
    }

    @Override
    public String name() {
        return "find_image";
    }

    @Override
    public Object execute(Map<String, Object> selector, Map<String, Object> params, ExecutionContext context) {
        ActionParams p = ActionParams.of(name(), params);
        ImageQuery query = query(p);
        Basis basis = Basis.from(p);
        boolean preview = p.bool("preview", false);
        boolean click = p.bool("click", false);
        long timeoutMs = p.longValue("timeout", DEFAULT_TIMEOUT_MS);
        long intervalMs = Math.max(1L, p.longValue("interval", DEFAULT_INTERVAL_MS));

        Point match = poll(query, timeoutMs, intervalMs)
                .orElseThrow(() -> new ActionException("image_not_found",
                        "image not found within " + timeoutMs + "ms: " + query.template()));
        Point relative = resolver.fromScreen(basis, match, selector);
        if (click && !preview) {
            pointer.click(match);
        }
        return new Coordinate(match, relative, basis, query.dpi(), preview);
    }

    private Optional<Point> poll(ImageQuery query, long timeoutMs, long intervalMs) {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (true) {
            Optional<Point> found;
            try {
                found = matcher.find(query);
            } catch (RuntimeException e) {
                throw ActionException.backend(name(), e);
            }
            if (found.isPresent()) {
                return found;
            }
            if (System.currentTimeMillis() >= deadline) {
                return Optional.empty();
            }
            try {
                Thread.sleep(intervalMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ActionException("interrupted", name() + " interrupted", e);
            }
        }
    }

    private ImageQuery query(ActionParams p) {
        String template = p.has("image") ? p.requireString("image") : p.requireString("path");
        try {
            return new ImageQuery(
                    template,
                    p.doubleValue("scale", 1.0),
                    p.doubleValue("tolerance", 0.0),
                    (int) p.longValue("dpi", pointer.dpi()),
                    region(p)
            );
        } catch (IllegalArgumentException e) {
            throw ActionException.invalidParams(name(), e.getMessage());
        }
    }

    private static Bounds region(ActionParams p) {
        if (!(p.raw("region") instanceof Map<?, ?> raw)) {
            return null;
        }
        return new Bounds(intOf(raw.get("x")), intOf(raw.get("y")), intOf(raw.get("width")), intOf(raw.get("height")));
    }

    private static int intOf(Object value) {
        return value instanceof Number number ? number.intValue() : 0;
    }
}
