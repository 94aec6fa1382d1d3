package io.deskflow.observability;

public record BucketStats(long total, long succeeded, long failed, long skipped) {
    public static final BucketStats EMPTY = new BucketStats(0L, 0L, 0L, 0L);

    /**
     * Succeeded over succeeded-plus-failed; skipped runs do not count either way.
     */
    public double successRate() {
        long decided = succeeded + failed;
        return decided == 0L ? 0.0 : (double) succeeded / decided;
    }
}
