package io.deskflow.lock;

import io.deskflow.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Path-addressed exclusive marker. The marker file exists while the lock is held
 * and carries a JSON {@link LockStamp}.
 *
 * <p>Creation uses {@code CREATE_NEW}, so two acquirers racing on the same path
 * (threads or processes) cannot both win. A positive {@code staleAfterMs} lets
 * {@link #acquire(Path)} clear markers left behind by a crashed holder; zero
 * disables that recovery.
 */
public final class FileLock {
    private static final Logger log = LoggerFactory.getLogger(FileLock.class);

    static final long GUARD_STALE_MS = 10_000L;

    private final String holderId;
    private final long staleAfterMs;
    private final String host;

    public FileLock(String holderId) {
        this(holderId, 0L);
    }

    public FileLock(String holderId, long staleAfterMs) {
        this.holderId = holderId == null || holderId.isBlank() ? "deskflow" : holderId.trim();
        this.staleAfterMs = Math.max(0L, staleAfterMs);
        this.host = localHostName();
    }

    public long staleAfterMs() {
        return staleAfterMs;
    }

    public LockHandle acquire(Path path) {
        Optional<LockHandle> handle = tryAcquire(path);
        if (handle.isPresent()) {
            return handle.get();
        }
        if (staleAfterMs > 0L && clearIfStale(path, staleAfterMs)) {
            handle = tryAcquire(path);
            if (handle.isPresent()) {
                return handle.get();
            }
        }
        throw new LockBusyException(path, readStamp(path).orElse(null));
    }

    /**
     * Like {@link #acquire(Path)} but refuses to recover a stale marker, reporting
     * it instead so the caller can decide.
     */
    public LockHandle acquireStrict(Path path) {
        Optional<LockHandle> handle = tryAcquire(path);
        if (handle.isPresent()) {
            return handle.get();
        }
        long age = ageMs(path);
        if (staleAfterMs > 0L && age >= staleAfterMs) {
            throw new StaleLockException(path, age);
        }
        throw new LockBusyException(path, readStamp(path).orElse(null));
    }

    public Optional<LockHandle> tryAcquire(Path path) {
        LockStamp stamp = new LockStamp(
                holderId,
                ProcessHandle.current().pid(),
                host,
                Instant.now().toEpochMilli(),
                UUID.randomUUID().toString()
        );
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (SeekableByteChannel channel = Files.newByteChannel(path,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                channel.write(ByteBuffer.wrap(Jsons.toCompactJson(stamp).getBytes(StandardCharsets.UTF_8)));
            }
            return Optional.of(new LockHandle(this, path, stamp));
        } catch (FileAlreadyExistsException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new RuntimeException("Failed to create lock marker: " + path, e);
        }
    }

    /**
     * Unconditionally deletes the marker. Used by explicit stop and manual recovery.
     */
    public boolean release(Path path) {
        try {
            return Files.deleteIfExists(path);
        } catch (IOException e) {
            throw new RuntimeException("Failed to delete lock marker: " + path, e);
        }
    }

    public boolean isHeld(Path path) {
        return Files.exists(path);
    }

    public Optional<LockStamp> readStamp(Path path) {
        try {
            String raw = Files.readString(path, StandardCharsets.UTF_8);
            if (raw.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(Jsons.mapper().readValue(raw, LockStamp.class));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            log.warn("Unreadable lock marker {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Age of the marker from its stamp, or from the file timestamp when the stamp is
     * missing or unreadable. Returns -1 when no marker exists.
     */
    public long ageMs(Path path) {
        long now = Instant.now().toEpochMilli();
        Optional<LockStamp> stamp = readStamp(path);
        if (stamp.isPresent()) {
            return stamp.get().ageMs(now);
        }
        try {
            return Math.max(0L, now - Files.getLastModifiedTime(path).toMillis());
        } catch (NoSuchFileException e) {
            return -1L;
        } catch (IOException e) {
            throw new RuntimeException("Failed to stat lock marker: " + path, e);
        }
    }

    /**
     * Deletes the marker when it is at least {@code thresholdMs} old. Clearers
     * serialize on a sibling guard file and re-read the stamp under it, so a marker
     * re-created after the age check is never deleted.
     */
    public boolean clearIfStale(Path path, long thresholdMs) {
        if (thresholdMs <= 0L) {
            return false;
        }
        Optional<LockStamp> judged = readStamp(path);
        long age = judged.isPresent() ? judged.get().ageMs(Instant.now().toEpochMilli()) : ageMs(path);
        if (age < thresholdMs) {
            return false;
        }
        Path guard = guardPath(path);
        if (!enterGuard(guard)) {
            return false;
        }
        try {
            Optional<LockStamp> current = readStamp(path);
            boolean sameMarker = judged.isPresent()
                    ? current.isPresent() && current.get().token().equals(judged.get().token())
                    : current.isEmpty() && ageMs(path) >= thresholdMs;
            if (!sameMarker || !release(path)) {
                return false;
            }
            log.warn("Cleared stale lock {} (age={}ms, holder={}, pid={})",
                    path,
                    age,
                    judged.map(LockStamp::holder).orElse("unknown"),
                    judged.map(LockStamp::pid).orElse(-1L));
            return true;
        } finally {
            release(guard);
        }
    }

    void releaseOwned(Path path, LockStamp stamp) {
        Optional<LockStamp> current = readStamp(path);
        if (current.isPresent() && !current.get().token().equals(stamp.token())) {
            log.warn("Lock {} was re-acquired by {} after recovery; leaving it in place", path, current.get().holder());
            return;
        }
        release(path);
    }

    static Path guardPath(Path path) {
        return path.resolveSibling(path.getFileName() + ".recover");
    }

    private static boolean enterGuard(Path guard) {
        try {
            Files.createFile(guard);
            return true;
        } catch (FileAlreadyExistsException e) {
            // Left behind by a clearer that died inside the guard.
            try {
                long age = Instant.now().toEpochMilli() - Files.getLastModifiedTime(guard).toMillis();
                if (age >= GUARD_STALE_MS) {
                    log.warn("Removing abandoned recovery guard {} (age={}ms)", guard, age);
                    Files.deleteIfExists(guard);
                }
            } catch (NoSuchFileException ignored) {
                // Released between the two calls.
            } catch (IOException io) {
                throw new RuntimeException("Failed to inspect recovery guard: " + guard, io);
            }
            return false;
        } catch (IOException e) {
            throw new RuntimeException("Failed to create recovery guard: " + guard, e);
        }
    }

    private static String localHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "localhost";
        }
    }
}
