package io.deskflow.lock;

/**
 * Content written into a lock marker. {@code token} is unique per acquisition,
 * so a handle never deletes a marker that someone else re-created.
 */
public record LockStamp(
        String holder,
        long pid,
        String host,
        long acquiredAtMs,
        String token
) {
    public long ageMs(long nowMs) {
        return Math.max(0L, nowMs - acquiredAtMs);
    }
}
