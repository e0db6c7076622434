package com.riskcast.backend.service.benchmark;

/**
 * Latency summary in milliseconds.
 */
public record LatencyStats(double minMs, double maxMs, double avgMs, double p50Ms, double p95Ms, double p99Ms) {

    static final LatencyStats EMPTY = new LatencyStats(0, 0, 0, 0, 0, 0);

    /**
     * Nearest-rank percentiles over latencies already sorted ascending.
     */
    static LatencyStats fromSorted(long[] sortedNanos) {
        if (sortedNanos.length == 0) {
            return EMPTY;
        }
        double total = 0;
        for (long value : sortedNanos) {
            total += value;
        }
        return new LatencyStats(
                toMillis(sortedNanos[0]),
                toMillis(sortedNanos[sortedNanos.length - 1]),
                total / sortedNanos.length / 1_000_000.0,
                toMillis(percentile(sortedNanos, 50)),
                toMillis(percentile(sortedNanos, 95)),
                toMillis(percentile(sortedNanos, 99)));
    }

    static long percentile(long[] sortedNanos, double percentile) {
        int index = (int) Math.ceil(percentile / 100.0 * sortedNanos.length) - 1;
        return sortedNanos[Math.max(0, Math.min(sortedNanos.length - 1, index))];
    }

    private static double toMillis(long nanos) {
        return nanos / 1_000_000.0;
    }
}
