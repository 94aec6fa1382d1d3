package io.deskflow.action.desktop;

/**
 * A resolved position: {@code screen} is where a pointer action lands,
 * {@code relative} is the same point expressed in {@code basis}.
 */
public record Coordinate(
        Point screen,
        Point relative,
        Basis basis,
        int dpi,
        boolean preview
) {
}
