package io.deskflow.action.desktop;

import java.util.Map;
import java.util.Optional;

/**
 * Looks up on-screen bounds of UI elements and top-level windows described by a
 * selector (UIA, Win32 or anchor descriptors, backend-specific).
 */
public interface DesktopLocator {
    Optional<Bounds> elementBounds(Map<String, Object> selector);

    Optional<Bounds> windowBounds(Map<String, Object> selector);
}
