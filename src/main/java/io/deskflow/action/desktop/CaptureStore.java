package io.deskflow.action.desktop;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Coordinates captured during runs, kept for the editor to turn into selectors.
 * Only the most recent {@code capacity} captures are retained.
 */
public final class CaptureStore {
    public static final int DEFAULT_CAPACITY = 500;

    private final int capacity;
    private final Deque<Coordinate> captured = new ArrayDeque<>();

    public CaptureStore() {
        this(DEFAULT_CAPACITY);
    }

    public CaptureStore(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
    }

    public synchronized void add(Coordinate coordinate) {
        if (captured.size() == capacity) {
            captured.removeFirst();
        }
        captured.addLast(coordinate);
    }

    public synchronized List<Coordinate> list() {
        return List.copyOf(captured);
    }

    public synchronized void clear() {
        captured.clear();
    }
}
