package io.deskflow.lock;

import io.deskflow.DeskFlowException;

import java.nio.file.Path;

public final class LockBusyException extends DeskFlowException {
    private final Path path;
    private final LockStamp holder;

    public LockBusyException(Path path, LockStamp holder) {
        super("lock_busy", holder == null
                ? "Lock is held: " + path
                : "Lock is held: " + path + " (holder=" + holder.holder() + ", pid=" + holder.pid() + ")");
        this.path = path;
        this.holder = holder;
    }

    public Path path() {
        return path;
    }

    public LockStamp holder() {
        return holder;
    }
}
