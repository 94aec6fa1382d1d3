package io.deskflow.observability;

import java.util.List;

/**
 * Run duration distribution in milliseconds. {@code histogram} counts are per
 * bucket (not cumulative); the last bucket has {@code upperBoundMs == -1} for
 * durations above every bound.
 */
public record DurationStats(
        long count,
        long minMs,
        long maxMs,
        double meanMs,
        long p50Ms,
        long p95Ms,
        List<HistogramBucket> histogram
) {
    public DurationStats {
        histogram = histogram == null ? List.of() : List.copyOf(histogram);
    }

    public record HistogramBucket(long upperBoundMs, long count) {
        public boolean isOverflow() {
            return upperBoundMs < 0L;
        }
    }
}
