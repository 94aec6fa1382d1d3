package io.deskflow.observability;

import java.util.Locale;
import java.util.Map;

public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(StatsSnapshot stats) {
        StringBuilder sb = new StringBuilder();
        BucketStats t = stats.totals();
        appendGauge(sb, "deskflow_runs_total", "Runs grouped by status", "status", "success", t.succeeded());
        appendGauge(sb, "deskflow_runs_total", "Runs grouped by status", "status", "failed", t.failed());
        appendGauge(sb, "deskflow_runs_total", "Runs grouped by status", "status", "skipped", t.skipped());
        appendMapGauge(sb, "deskflow_run_failures_total", "Failed runs grouped by reason", "reason", stats.failureReasons());

        sb.append("# HELP deskflow_flow_runs_total Runs grouped by flow and status\n");
        sb.append("# TYPE deskflow_flow_runs_total gauge\n");
        for (Map.Entry<String, BucketStats> e : stats.byFlow().entrySet()) {
            String flow = escapeLabel(e.getKey());
            sb.append("deskflow_flow_runs_total{flow=\"").append(flow).append("\",status=\"success\"} ")
                    .append(e.getValue().succeeded()).append('\n');
            sb.append("deskflow_flow_runs_total{flow=\"").append(flow).append("\",status=\"failed\"} ")
                    .append(e.getValue().failed()).append('\n');
        }

        sb.append("# HELP deskflow_selector_results_total Selector resolutions grouped by outcome\n");
        sb.append("# TYPE deskflow_selector_results_total gauge\n");
        for (Map.Entry<String, SelectorStats> e : stats.selectors().entrySet()) {
            String selector = escapeLabel(e.getKey());
            sb.append("deskflow_selector_results_total{selector=\"").append(selector).append("\",outcome=\"success\"} ")
                    .append(e.getValue().success()).append('\n');
            sb.append("deskflow_selector_results_total{selector=\"").append(selector).append("\",outcome=\"failure\"} ")
                    .append(e.getValue().failure()).append('\n');
        }

        appendHistogram(sb, stats.durations());
        return sb.toString();
    }

    private static void appendHistogram(StringBuilder sb, DurationStats d) {
        String metric = "deskflow_run_duration_ms";
        sb.append("# HELP ").append(metric).append(" Run duration in milliseconds\n");
        sb.append("# TYPE ").append(metric).append(" histogram\n");
        long cumulative = 0L;
        for (DurationStats.HistogramBucket bucket : d.histogram()) {
            cumulative += bucket.count();
            String le = bucket.isOverflow() ? "+Inf" : Long.toString(bucket.upperBoundMs());
            sb.append(metric).append("_bucket{le=\"").append(le).append("\"} ").append(cumulative).append('\n');
        }
        sb.append(metric).append("_sum ").append(String.format(Locale.ROOT, "%.0f", d.meanMs() * d.count())).append('\n');
        sb.append(metric).append("_count ").append(d.count()).append('\n');
        appendGauge(sb, "deskflow_run_duration_quantile_ms", "Run duration percentiles in milliseconds", "quantile", "0.5", d.p50Ms());
        appendGauge(sb, "deskflow_run_duration_quantile_ms", "Run duration percentiles in milliseconds", "quantile", "0.95", d.p95Ms());
    }

    private static void appendMapGauge(StringBuilder sb, String metric, String help, String label, Map<String, Long> values) {
        sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        for (Map.Entry<String, Long> e : values.entrySet()) {
            sb.append(metric).append('{')
                    .append(label).append("=\"").append(escapeLabel(e.getKey())).append("\"}")
                    .append(' ').append(e.getValue()).append('\n');
        }
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, String label, String labelValue, long value) {
        if (!sb.toString().contains("# HELP " + metric + " ")) {
            sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
            sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        }
        sb.append(metric);
        if (label != null && labelValue != null) {
            sb.append('{').append(label).append("=\"").append(escapeLabel(labelValue)).append("\"}");
        }
        sb.append(' ').append(value).append('\n');
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }
}
