package io.deskflow.action.desktop;

import io.deskflow.action.ActionException;
import io.deskflow.action.ActionParams;

import java.util.Locale;

/**
 * Reference frame of a coordinate: relative to an element, to a window, or
 * absolute on the screen.
 */
public enum Basis {
    ELEMENT,
    WINDOW,
    SCREEN;

    public static Basis fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return SCREEN;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown coordinate basis: " + raw, e);
        }
    }

    /**
     * Reads the {@code basis} param; an unknown name fails as invalid params of
     * the action being executed.
     */
    public static Basis from(ActionParams params) {
        try {
            return fromString(params.string("basis", null));
        } catch (IllegalArgumentException e) {
            throw ActionException.invalidParams(params.action(), e.getMessage());
        }
    }
}
