package io.deskflow.action.image;

import io.deskflow.action.desktop.Point;

import java.util.Optional;

public interface ImageMatcher {
    /**
     * Single non-blocking search of the current screen.
     *
     * @return screen coordinate of the match center, empty when nothing matched
     */
    Optional<Point> find(ImageQuery query);
}
