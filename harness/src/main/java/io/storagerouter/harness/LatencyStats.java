package io.storagerouter.harness;

import java.util.Arrays;

/**
 * Latency percentiles over every invocation of a run, in nanoseconds. Nearest-rank
 * method; all zeros when nothing was measured.
 */
public record LatencyStats(long count, long p50, long p90, long p95, long p99, long max) {

    public static final LatencyStats EMPTY = new LatencyStats(0, 0, 0, 0, 0, 0);

    /** Summarizes raw samples; the array is sorted in place. */
    public static LatencyStats of(long[] samplesNanos) {
        if (samplesNanos.length == 0) {
            return EMPTY;
        }
        Arrays.sort(samplesNanos);
        return new LatencyStats(
                samplesNanos.length,
                percentile(samplesNanos, 50),
                percentile(samplesNanos, 90),
                percentile(samplesNanos, 95),
                percentile(samplesNanos, 99),
                samplesNanos[samplesNanos.length - 1]);
    }

    private static long percentile(long[] sorted, int pct) {
        int rank = (int) Math.ceil(pct / 100.0 * sorted.length);
        return sorted[Math.max(0, rank - 1)];
    }
}
