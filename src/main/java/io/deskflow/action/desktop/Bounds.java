package io.deskflow.action.desktop;

public record Bounds(int x, int y, int width, int height) {
    public Point origin() {
        return new Point(x, y);
    }

    public Point center() {
        return new Point(x + width / 2, y + height / 2);
    }

    public boolean contains(Point point) {
        return point.x() >= x && point.x() < x + width
                && point.y() >= y && point.y() < y + height;
    }
}
