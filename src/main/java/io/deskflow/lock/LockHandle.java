package io.deskflow.lock;

import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;

public final class LockHandle implements AutoCloseable {
    private final FileLock owner;
    private final Path path;
    private final LockStamp stamp;
    private final AtomicBoolean released;

    LockHandle(FileLock owner, Path path, LockStamp stamp) {
        this.owner = owner;
        this.path = path;
        this.stamp = stamp;
        this.released = new AtomicBoolean(false);
    }

    public Path path() {
        return path;
    }

    public LockStamp stamp() {
        return stamp;
    }

    public boolean isReleased() {
        return released.get();
    }

    public void release() {
        if (released.compareAndSet(false, true)) {
            owner.releaseOwned(path, stamp);
        }
    }

    @Override
    public void close() {
        release();
    }
}
