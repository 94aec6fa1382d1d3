package io.deskflow.action.image;

import io.deskflow.action.desktop.Bounds;

/**
 * Template search request. {@code dpi} is the resolution the template was captured
 * at; matchers rescale it to the screen resolution via {@link #effectiveScale(int)}.
 */
public record ImageQuery(
        String template,
        double scale,
        double tolerance,
        int dpi,
        Bounds region
) {
    public ImageQuery {
        if (template == null || template.isBlank()) {
            throw new IllegalArgumentException("template cannot be empty");
        }
        if (scale <= 0.0) {
            throw new IllegalArgumentException("scale must be positive");
        }
        if (tolerance < 0.0 || tolerance > 1.0) {
            throw new IllegalArgumentException("tolerance must be within 0..1");
        }
        if (dpi <= 0) {
            throw new IllegalArgumentException("dpi must be positive");
        }
    }

    public double effectiveScale(int screenDpi) {
        return scale * screenDpi / dpi;
    }
}
