package io.deskflow.observability;

public record SelectorStats(long success, long failure) {
    public double successRate() {
        long total = success + failure;
        return total == 0L ? 0.0 : (double) success / total;
    }
}
