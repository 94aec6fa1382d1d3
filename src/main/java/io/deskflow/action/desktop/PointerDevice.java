package io.deskflow.action.desktop;

public interface PointerDevice {
    Point position();

    void click(Point screen);

    default int dpi() {
        return 96;
    }
}
