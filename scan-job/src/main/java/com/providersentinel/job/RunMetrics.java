package com.providersentinel.job;

import com.providersentinel.core.detection.EngineResult;
import com.providersentinel.core.report.ExecutionMetrics;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryPoolMXBean;
import java.lang.management.MemoryType;
import java.lang.management.MemoryUsage;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Gathers the execution metrics of one run: wall time from construction to
 * {@link #snapshot}, and the peak heap usage reported by the JVM memory
 * pools.
 *
 * @since 1.0.0
 */
public class RunMetrics {

    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    private final long startNanos;

    public RunMetrics() {
        this.startNanos = System.nanoTime();
        for (MemoryPoolMXBean pool : ManagementFactory.getMemoryPoolMXBeans()) {
            if (pool.getType() == MemoryType.HEAP) {
                pool.resetPeakUsage();
            }
        }
    }

    public double elapsedSeconds() {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }

    /**
     * @return sum of the peak usage of every heap pool, in MiB
     */
    public double peakHeapMb() {
        long peak = 0;
        for (MemoryPoolMXBean pool : ManagementFactory.getMemoryPoolMXBeans()) {
            if (pool.getType() != MemoryType.HEAP) {
                continue;
            }
            MemoryUsage usage = pool.getPeakUsage();
            if (usage != null) {
                peak += usage.getUsed();
            }
        }
        return peak / BYTES_PER_MB;
    }

    /**
     * @param threads     worker pool size used
     * @param rowsSkipped input rows skipped by the loaders
     * @param result      engine result carrying per-detector timings
     * @return the metrics as of now
     */
    public ExecutionMetrics snapshot(int threads, long rowsSkipped, EngineResult result) {
        Map<String, Long> detectorMillis = new LinkedHashMap<>();
        result.getDetectorMillis().forEach((kind, millis) -> detectorMillis.put(kind.getId(), millis));
        return new ExecutionMetrics(elapsedSeconds(), peakHeapMb(), threads, rowsSkipped, detectorMillis);
    }
}
