package com.providersentinel.core.report;

import com.providersentinel.core.model.SignalKind;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The complete in-memory result of a scan.
 *
 * <p>
 * {@code signalCounts} holds the number of flagged providers per signal kind
 * and always lists all six kinds; {@code overlapCounts} maps a number of
 * distinct signal kinds (1 to 6) to the number of providers flagged by
 * exactly that many, so its values sum to {@code totalProvidersFlagged}.
 * </p>
 *
 * @since 1.0.0
 */
public final class FraudScanReport {

    public static final String TOOL_VERSION = "1.0.0";

    private final Instant generatedAt;
    private final String toolVersion;
    private final long totalProvidersScanned;
    private final Map<String, Long> signalCounts;
    private final Map<Integer, Long> overlapCounts;
    private final List<SignalKind> failedSignals;
    private final List<FlaggedProviderReport> flaggedProviders;
    private final ExecutionMetrics executionMetrics;

    public FraudScanReport(Instant generatedAt,
            long totalProvidersScanned,
            Map<String, Long> signalCounts,
            Map<Integer, Long> overlapCounts,
            List<SignalKind> failedSignals,
            List<FlaggedProviderReport> flaggedProviders,
            ExecutionMetrics executionMetrics) {
        this.generatedAt = Objects.requireNonNull(generatedAt, "generatedAt must not be null");
        this.toolVersion = TOOL_VERSION;
        this.totalProvidersScanned = totalProvidersScanned;
        this.signalCounts = Collections.unmodifiableMap(new LinkedHashMap<>(signalCounts));
        this.overlapCounts = Collections.unmodifiableMap(new LinkedHashMap<>(overlapCounts));
        this.failedSignals = List.copyOf(failedSignals);
        this.flaggedProviders = List.copyOf(flaggedProviders);
        this.executionMetrics = Objects.requireNonNull(executionMetrics, "executionMetrics must not be null");
    }

    /**
     * @param metrics runtime figures gathered by the job
     * @return a copy of this report carrying {@code metrics}
     */
    public FraudScanReport withExecutionMetrics(ExecutionMetrics metrics) {
        return new FraudScanReport(generatedAt, totalProvidersScanned, signalCounts, overlapCounts,
                failedSignals, flaggedProviders, metrics);
    }

    public Instant getGeneratedAt() {
        return generatedAt;
    }

    public String getToolVersion() {
        return toolVersion;
    }

    public long getTotalProvidersScanned() {
        return totalProvidersScanned;
    }

    public int getTotalProvidersFlagged() {
        return flaggedProviders.size();
    }

    public Map<String, Long> getSignalCounts() {
        return signalCounts;
    }

    public Map<Integer, Long> getOverlapCounts() {
        return overlapCounts;
    }

    public List<SignalKind> getFailedSignals() {
        return failedSignals;
    }

    /**
     * @return reports in ascending identifier order
     */
    public List<FlaggedProviderReport> getFlaggedProviders() {
        return flaggedProviders;
    }

    public ExecutionMetrics getExecutionMetrics() {
        return executionMetrics;
    }

    @Override
    public String toString() {
        return "FraudScanReport{" +
                "generatedAt=" + generatedAt +
                ", scanned=" + totalProvidersScanned +
                ", flagged=" + flaggedProviders.size() +
                ", signalCounts=" + signalCounts +
                ", failedSignals=" + failedSignals +
                '}';
    }
}
