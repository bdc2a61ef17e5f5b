package com.providersentinel.core.report;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Runtime figures of one scan, supplied by the hosting job rather than
 * computed by the composer.
 *
 * @since 1.0.0
 */
public final class ExecutionMetrics {

    /** Placeholder used until the job fills in real figures. */
    public static final ExecutionMetrics NONE = new ExecutionMetrics(0, 0, 0, 0, Map.of());

    private final double runtimeSeconds;
    private final double peakMemoryMb;
    private final int detectorThreads;
    private final long rowsSkipped;
    private final Map<String, Long> detectorMillis;

    /**
     * @param runtimeSeconds  end-to-end wall time
     * @param peakMemoryMb    peak heap usage observed
     * @param detectorThreads worker pool size
     * @param rowsSkipped     input rows skipped by the loaders
     * @param detectorMillis  wall time per signal kind identifier
     */
    public ExecutionMetrics(double runtimeSeconds, double peakMemoryMb, int detectorThreads,
            long rowsSkipped, Map<String, Long> detectorMillis) {
        this.runtimeSeconds = runtimeSeconds;
        this.peakMemoryMb = peakMemoryMb;
        this.detectorThreads = detectorThreads;
        this.rowsSkipped = rowsSkipped;
        this.detectorMillis = Collections.unmodifiableMap(new LinkedHashMap<>(
                Objects.requireNonNull(detectorMillis, "detectorMillis must not be null")));
    }

    public double getRuntimeSeconds() {
        return runtimeSeconds;
    }

    public double getPeakMemoryMb() {
        return peakMemoryMb;
    }

    public int getDetectorThreads() {
        return detectorThreads;
    }

    public long getRowsSkipped() {
        return rowsSkipped;
    }

    public Map<String, Long> getDetectorMillis() {
        return detectorMillis;
    }

    @Override
    public String toString() {
        return "ExecutionMetrics{" +
                "runtimeSeconds=" + runtimeSeconds +
                ", peakMemoryMb=" + peakMemoryMb +
                ", detectorThreads=" + detectorThreads +
                ", rowsSkipped=" + rowsSkipped +
                '}';
    }
}
