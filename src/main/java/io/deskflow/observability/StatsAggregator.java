package io.deskflow.observability;

import io.deskflow.model.RunRecord;
import io.deskflow.model.SelectorOutcome;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.temporal.IsoFields;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds run records into a {@link StatsSnapshot}. Writers are serialized and only
 * invalidate the published snapshot; the next reader rebuilds it once and later
 * readers pick it up without locking.
 *
 * <p>Count, min, max and mean cover every run. Percentiles are computed over the
 * most recent {@link #DEFAULT_PERCENTILE_WINDOW} durations.
 */
public final class StatsAggregator {
    static final long[] HISTOGRAM_BOUNDS_MS = {100L, 500L, 1_000L, 5_000L, 10_000L, 30_000L, 60_000L, 300_000L};
    static final int DEFAULT_PERCENTILE_WINDOW = 10_000;
    private static final DateTimeFormatter MONTH = DateTimeFormatter.ofPattern("yyyy-MM");

    private final ZoneId zone;
    private final int percentileWindow;

    private final Counter totals = new Counter();
    private final Map<String, Long> failureReasons = new HashMap<>();
    private final Map<String, long[]> selectors = new HashMap<>();
    private final Map<String, Counter> byDay = new HashMap<>();
    private final Map<String, Counter> byWeek = new HashMap<>();
    private final Map<String, Counter> byMonth = new HashMap<>();
    private final Map<String, Counter> byFlow = new HashMap<>();
    private final Deque<Long> recentDurations = new ArrayDeque<>();
    private final long[] histogram = new long[HISTOGRAM_BOUNDS_MS.length + 1];
    private long durationCount;
    private long durationMinMs = Long.MAX_VALUE;
    private long durationMaxMs = Long.MIN_VALUE;
    private long durationSumMs;

    private volatile StatsSnapshot snapshot;

    public StatsAggregator() {
        this(ZoneId.systemDefault());
    }

    public StatsAggregator(ZoneId zone) {
        this(zone, DEFAULT_PERCENTILE_WINDOW);
    }

    StatsAggregator(ZoneId zone, int percentileWindow) {
        if (percentileWindow < 1) {
            throw new IllegalArgumentException("percentileWindow must be positive");
        }
        this.zone = zone;
        this.percentileWindow = percentileWindow;
        this.snapshot = build();
    }

    public ZoneId zone() {
        return zone;
    }

    public StatsSnapshot snapshot() {
        StatsSnapshot current = snapshot;
        return current != null ? current : rebuild();
    }

    public void accept(RunRecord record) {
        acceptAll(List.of(record));
    }

    public synchronized void acceptAll(Collection<RunRecord> records) {
        if (records.isEmpty()) {
            return;
        }
        for (RunRecord record : records) {
            fold(record);
        }
        snapshot = null;
    }

    private synchronized StatsSnapshot rebuild() {
        if (snapshot == null) {
            snapshot = build();
        }
        return snapshot;
    }

    private void fold(RunRecord record) {
        totals.add(record);
        LocalDate day = Instant.ofEpochMilli(record.startedAtMs()).atZone(zone).toLocalDate();
        byDay.computeIfAbsent(day.toString(), k -> new Counter()).add(record);
        byWeek.computeIfAbsent(weekKey(day), k -> new Counter()).add(record);
        byMonth.computeIfAbsent(day.format(MONTH), k -> new Counter()).add(record);
        byFlow.computeIfAbsent(record.flowName() == null ? "" : record.flowName(), k -> new Counter()).add(record);

        switch (record.status()) {
            case FAILED -> {
                String reason = record.reason() == null || record.reason().isBlank() ? "unknown" : record.reason();
                failureReasons.merge(reason, 1L, Long::sum);
                addDuration(record.durationMs());
            }
            case SUCCESS -> addDuration(record.durationMs());
            case SKIPPED -> {
                // never started, so no duration
            }
        }
        for (SelectorOutcome outcome : record.selectorOutcomes()) {
            long[] counts = selectors.computeIfAbsent(outcome.selector(), k -> new long[2]);
            counts[outcome.success() ? 0 : 1]++;
        }
    }

    private void addDuration(long durationMs) {
        if (recentDurations.size() == percentileWindow) {
            recentDurations.removeFirst();
        }
        recentDurations.addLast(durationMs);
        durationCount++;
        durationMinMs = Math.min(durationMinMs, durationMs);
        durationMaxMs = Math.max(durationMaxMs, durationMs);
        durationSumMs += durationMs;
        histogram[bucketIndex(durationMs)]++;
    }

    static int bucketIndex(long durationMs) {
        for (int i = 0; i < HISTOGRAM_BOUNDS_MS.length; i++) {
            if (durationMs <= HISTOGRAM_BOUNDS_MS[i]) {
                return i;
            }
        }
        return HISTOGRAM_BOUNDS_MS.length;
    }

    static String weekKey(LocalDate day) {
        return String.format("%d-W%02d", day.get(IsoFields.WEEK_BASED_YEAR), day.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
    }

    private StatsSnapshot build() {
        Map<String, SelectorStats> selectorView = new HashMap<>();
        selectors.forEach((k, v) -> selectorView.put(k, new SelectorStats(v[0], v[1])));
        return new StatsSnapshot(
                System.currentTimeMillis(),
                totals.view(),
                failureReasons,
                selectorView,
                durationStats(),
                view(byDay),
                view(byWeek),
                view(byMonth),
                view(byFlow)
        );
    }

    private DurationStats durationStats() {
        List<DurationStats.HistogramBucket> buckets = new ArrayList<>();
        for (int i = 0; i < histogram.length; i++) {
            long bound = i < HISTOGRAM_BOUNDS_MS.length ? HISTOGRAM_BOUNDS_MS[i] : -1L;
            buckets.add(new DurationStats.HistogramBucket(bound, histogram[i]));
        }
        if (durationCount == 0L) {
            return new DurationStats(0L, 0L, 0L, 0.0, 0L, 0L, buckets);
        }
        long[] sorted = recentDurations.stream().mapToLong(Long::longValue).toArray();
        Arrays.sort(sorted);
        return new DurationStats(
                durationCount,
                durationMinMs,
                durationMaxMs,
                (double) durationSumMs / durationCount,
                percentile(sorted, 0.50),
                percentile(sorted, 0.95),
                buckets
        );
    }

    // Nearest-rank percentile.
    static long percentile(long[] sorted, double p) {
        int rank = (int) Math.ceil(p * sorted.length);
        return sorted[Math.max(0, rank - 1)];
    }

    private static Map<String, BucketStats> view(Map<String, Counter> counters) {
        Map<String, BucketStats> out = new HashMap<>();
        counters.forEach((k, v) -> out.put(k, v.view()));
        return out;
    }

    private static final class Counter {
        private long total;
        private long succeeded;
        private long failed;
        private long skipped;

        void add(RunRecord record) {
            total++;
            switch (record.status()) {
                case SUCCESS -> succeeded++;
                case FAILED -> failed++;
                case SKIPPED -> skipped++;
            }
        }

        BucketStats view() {
            return new BucketStats(total, succeeded, failed, skipped);
        }
    }
}
