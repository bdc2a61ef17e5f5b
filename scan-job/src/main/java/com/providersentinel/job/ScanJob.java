package com.providersentinel.job;

import com.providersentinel.core.config.SignalRulesConfig;
import com.providersentinel.core.config.SignalRulesLoader;
import com.providersentinel.core.detection.EngineResult;
import com.providersentinel.core.detection.SignalDetector;
import com.providersentinel.core.detection.SignalDetectorFactory;
import com.providersentinel.core.detection.SignalEngine;
import com.providersentinel.core.ingest.DatasetLoadException;
import com.providersentinel.core.ingest.DatasetLoader;
import com.providersentinel.core.ingest.RawDatasets;
import com.providersentinel.core.report.FraudScanReport;
import com.providersentinel.core.report.ReportComposer;
import com.providersentinel.core.resolve.EntityResolver;
import com.providersentinel.core.resolve.ResolvedDataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * Main entry point for the provider scan.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   claims.csv, UPDATED.csv, npidata_pfile*.csv
 *     → DatasetLoader (typed records, bad rows skipped)
 *     → EntityResolver (one ProviderView per valid identifier)
 *     → SignalEngine (six detectors on a worker pool)
 *     → ReportComposer (one report per flagged provider)
 *     → ReportWriter (JSON at OUTPUT_PATH)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * All configuration is resolved from environment variables via
 * {@link JobConfig}. A missing or unreadable input aborts the run with exit
 * status 1 before any detector executes, and no report is written.
 * </p>
 *
 * @since 1.0.0
 */
public final class ScanJob {

    private static final Logger LOG = LoggerFactory.getLogger(ScanJob.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private final JobConfig config;
    private final ReportComposer composer;
    private final ReportWriter writer;

    public ScanJob(JobConfig config) {
        this(config, new ReportComposer(), new ReportWriter());
    }

    ScanJob(JobConfig config, ReportComposer composer, ReportWriter writer) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.composer = Objects.requireNonNull(composer, "composer must not be null");
        this.writer = Objects.requireNonNull(writer, "writer must not be null");
    }

    public static void main(String[] args) {
        JobConfig config = JobConfig.fromEnvironment();
        LOG.info("Starting Provider Sentinel with config: {}", config);
        System.exit(new ScanJob(config).run());
    }

    /**
     * Run the scan and write the report.
     *
     * @return process exit status
     */
    public int run() {
        try {
            FraudScanReport report = scan();
            writer.write(report, config.getOutputPath());
            logSummary(report);
            return EXIT_OK;
        } catch (DatasetLoadException e) {
            LOG.error("Input data unavailable, no report written: {}", e.getMessage(), e);
            return EXIT_FAILURE;
        } catch (IOException e) {
            LOG.error("Failed to write report to {}", config.getOutputPath(), e);
            return EXIT_FAILURE;
        } catch (RuntimeException e) {
            LOG.error("Scan failed", e);
            return EXIT_FAILURE;
        }
    }

    /**
     * Run every phase up to the composed report, without writing it.
     *
     * @return the report with execution metrics attached
     * @throws DatasetLoadException  if an input is missing or unreadable
     * @throws IllegalStateException if the detection rules are invalid
     */
    FraudScanReport scan() {
        RunMetrics metrics = new RunMetrics();

        // 1. Detection rules first, so a bad configuration fails before any I/O
        SignalRulesConfig rulesConfig = SignalRulesLoader.load(config.getSignalsConfig());
        List<SignalDetector> detectors = SignalDetectorFactory.createAll(rulesConfig.getEnabledRules());

        // 2. Load and freeze the inputs
        LOG.info("Phase 1: loading data sources from {}", config.getDataDir().toAbsolutePath());
        RawDatasets raw = DatasetLoader.load(config.getDataDir());
        ResolvedDataset dataset = EntityResolver.resolve(raw);

        // 3. Detect
        LOG.info("Phase 2: detecting fraud signals");
        EngineResult result = new SignalEngine(detectors, config.getDetectorThreads()).run(dataset);

        // 4. Compose
        LOG.info("Phase 3: composing report");
        FraudScanReport report = composer.compose(dataset, result);
        return report.withExecutionMetrics(
                metrics.snapshot(config.getDetectorThreads(), raw.getTotalRowsSkipped(), result));
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static void logSummary(FraudScanReport report) {
        LOG.info("Providers scanned: {}", report.getTotalProvidersScanned());
        LOG.info("Providers flagged: {}", report.getTotalProvidersFlagged());
        report.getSignalCounts().forEach((kind, count) -> LOG.info("  {}: {}", kind, count));
        if (!report.getFailedSignals().isEmpty()) {
            LOG.warn("Signals that failed to run: {}", report.getFailedSignals());
        }
        LOG.info("Completed in {} s, peak heap {} MiB",
                String.format("%.1f", report.getExecutionMetrics().getRuntimeSeconds()),
                String.format("%.0f", report.getExecutionMetrics().getPeakMemoryMb()));
    }
}
