package io.deskflow.observability;

import java.time.LocalDate;
import java.util.Locale;
import java.util.Map;

/**
 * Standalone HTML dashboard: totals, failure reasons, selector success rates,
 * counts per period and a 35-day activity heatmap ending at {@code today}.
 */
public final class StatsHtmlRenderer {
    static final int HEATMAP_DAYS = 35;

    private StatsHtmlRenderer() {
    }

    public static String render(StatsSnapshot s, LocalDate today) {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("<!DOCTYPE html>\n<html>\n<head><meta charset='utf-8'><title>Run Metrics</title></head>\n<body>\n");
        sb.append("<h1>Run Metrics</h1>\n<ul>\n");
        sb.append("<li>Total runs: <span id='total'>").append(s.totals().total()).append("</span></li>\n");
        sb.append("<li>Succeeded: <span id='succeeded'>").append(s.totals().succeeded()).append("</span></li>\n");
        sb.append("<li>Failed: <span id='failed'>").append(s.totals().failed()).append("</span></li>\n");
        sb.append("<li>Skipped: <span id='skipped'>").append(s.totals().skipped()).append("</span></li>\n");
        sb.append("<li>Success rate: ").append(percent(s.totals().successRate())).append("</li>\n");
        DurationStats d = s.durations();
        sb.append("<li>Duration ms: min ").append(d.minMs())
                .append(", mean ").append(String.format(Locale.ROOT, "%.1f", d.meanMs()))
                .append(", p50 ").append(d.p50Ms())
                .append(", p95 ").append(d.p95Ms())
                .append(", max ").append(d.maxMs()).append("</li>\n");
        sb.append("</ul>\n");

        sb.append("<h2>Failure reasons</h2>\n<ul>");
        s.failureReasons().forEach((reason, count) ->
                sb.append("<li>").append(escape(reason)).append(": ").append(count).append("</li>"));
        sb.append("</ul>\n");

        sb.append("<h2>Selector success rates</h2>\n<ul>");
        s.selectors().forEach((selector, stats) ->
                sb.append("<li>").append(escape(selector)).append(": ").append(percent(stats.successRate())).append("</li>"));
        sb.append("</ul>\n");

        sb.append("<h2>Runs by period</h2>\n");
        appendPeriod(sb, "By day", s.byDay());
        appendPeriod(sb, "By week", s.byWeek());
        appendPeriod(sb, "By month", s.byMonth());
        appendPeriod(sb, "By flow", s.byFlow());

        sb.append("<h2>Daily activity heatmap</h2>\n");
        appendHeatmap(sb, s.byDay(), today);
        sb.append("</body>\n</html>\n");
        return sb.toString();
    }

    private static void appendPeriod(StringBuilder sb, String title, Map<String, BucketStats> buckets) {
        sb.append("<h3>").append(title).append("</h3><ul>");
        buckets.forEach((key, stats) -> sb.append("<li>").append(escape(key)).append(": ").append(stats.total()).append("</li>"));
        sb.append("</ul>\n");
    }

    private static void appendHeatmap(StringBuilder sb, Map<String, BucketStats> byDay, LocalDate today) {
        LocalDate start = today.minusDays(HEATMAP_DAYS - 1L);
        long max = 0L;
        for (int i = 0; i < HEATMAP_DAYS; i++) {
            max = Math.max(max, count(byDay, start.plusDays(i)));
        }
        sb.append("<table class='heatmap'>");
        for (int week = 0; week < HEATMAP_DAYS / 7; week++) {
            sb.append("<tr>");
            for (int weekday = 0; weekday < 7; weekday++) {
                LocalDate day = start.plusDays(week * 7L + weekday);
                long cnt = count(byDay, day);
                int intensity = max == 0L ? 255 : 255 - (int) (cnt * 255 / max);
                sb.append("<td title='").append(day).append(": ").append(cnt)
                        .append("' style='background-color: rgb(").append(intensity).append(",255,").append(intensity)
                        .append("); width:14px;height:14px'></td>");
            }
            sb.append("</tr>");
        }
        sb.append("</table>\n");
    }

    private static long count(Map<String, BucketStats> byDay, LocalDate day) {
        BucketStats stats = byDay.get(day.toString());
        return stats == null ? 0L : stats.total();
    }

    private static String percent(double rate) {
        return String.format(Locale.ROOT, "%.2f%%", rate * 100.0);
    }

    static String escape(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("'", "&#39;")
                .replace("\"", "&quot;");
    }
}
