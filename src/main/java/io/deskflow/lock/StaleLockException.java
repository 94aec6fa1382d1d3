package io.deskflow.lock;

import io.deskflow.DeskFlowException;

import java.nio.file.Path;

public final class StaleLockException extends DeskFlowException {
    private final Path path;
    private final long ageMs;

    public StaleLockException(Path path, long ageMs) {
        super("stale_lock", "Lock marker looks stale: " + path + " (age " + ageMs + "ms)");
        this.path = path;
        this.ageMs = ageMs;
    }

    public Path path() {
        return path;
    }

    public long ageMs() {
        return ageMs;
    }
}
