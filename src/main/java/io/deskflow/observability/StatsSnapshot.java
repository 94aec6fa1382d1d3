package io.deskflow.observability;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable view of everything the aggregator knows at one point. Period keys are
 * {@code yyyy-MM-dd}, ISO {@code yyyy-'W'ww} and {@code yyyy-MM}.
 */
public record StatsSnapshot(
        long generatedAtMs,
        BucketStats totals,
        Map<String, Long> failureReasons,
        Map<String, SelectorStats> selectors,
        DurationStats durations,
        Map<String, BucketStats> byDay,
        Map<String, BucketStats> byWeek,
        Map<String, BucketStats> byMonth,
        Map<String, BucketStats> byFlow
) {
    public StatsSnapshot {
        failureReasons = sorted(failureReasons);
        selectors = sorted(selectors);
        byDay = sorted(byDay);
        byWeek = sorted(byWeek);
        byMonth = sorted(byMonth);
        byFlow = sorted(byFlow);
    }

    private static <V> Map<String, V> sorted(Map<String, V> input) {
        return input == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(input));
    }
}
