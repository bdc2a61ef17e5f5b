package com.providersentinel.core.report;

import com.providersentinel.core.detection.EngineResult;
import com.providersentinel.core.model.ExclusionRecord;
import com.providersentinel.core.model.ProviderView;
import com.providersentinel.core.model.RegistryEntity;
import com.providersentinel.core.model.Severity;
import com.providersentinel.core.model.SignalHit;
import com.providersentinel.core.model.SignalKind;
import com.providersentinel.core.resolve.ProviderIds;
import com.providersentinel.core.resolve.ResolvedDataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Merges detector hits into one {@link FlaggedProviderReport} per provider.
 *
 * <ol>
 * <li>hits whose identifier is invalid are dropped;</li>
 * <li>the remaining hits are grouped by identifier, one report each;</li>
 * <li>the estimated overpayment of a report is the sum of its hits'
 * contributions;</li>
 * <li>every signal entry gets its FCA relevance, and the report carries the
 * relevance of its primary signal (highest severity, then kind order);</li>
 * <li>overlap counts record how many reports have 1 to 6 distinct
 * kinds;</li>
 * <li>reports are ordered by identifier.</li>
 * </ol>
 *
 * @since 1.0.0
 */
public class ReportComposer {

    private static final Logger LOG = LoggerFactory.getLogger(ReportComposer.class);

    private static final Comparator<SignalHit> PRIMARY_ORDER = Comparator
            .comparing(SignalHit::getSeverity)
            .thenComparing(SignalHit::getKind);

    private final Clock clock;

    public ReportComposer() {
        this(Clock.systemUTC());
    }

    public ReportComposer(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public FraudScanReport compose(ResolvedDataset dataset, EngineResult result) {
        Objects.requireNonNull(result, "result must not be null");
        return compose(dataset, result.getAllHits(), result.getFailedSignals());
    }

    /**
     * @param dataset       the resolved dataset the hits were produced from
     * @param hits          hits of every detector, in any order
     * @param failedSignals kinds whose detector failed
     * @return the composed report, without execution metrics
     */
    public FraudScanReport compose(ResolvedDataset dataset, List<SignalHit> hits, List<SignalKind> failedSignals) {
        Objects.requireNonNull(dataset, "dataset must not be null");
        Objects.requireNonNull(hits, "hits must not be null");
        Objects.requireNonNull(failedSignals, "failedSignals must not be null");

        Map<String, List<SignalHit>> byProvider = new TreeMap<>();
        int dropped = 0;
        for (SignalHit hit : hits) {
            if (!ProviderIds.isValid(hit.getProviderId())) {
                dropped++;
                continue;
            }
            byProvider.computeIfAbsent(hit.getProviderId(), k -> new ArrayList<>()).add(hit);
        }
        if (dropped > 0) {
            LOG.warn("Dropped {} hit(s) with an invalid provider identifier", dropped);
        }

        List<FlaggedProviderReport> reports = new ArrayList<>(byProvider.size());
        Map<SignalKind, Long> perKind = new EnumMap<>(SignalKind.class);
        Map<Integer, Long> overlap = new LinkedHashMap<>();
        for (int n = 1; n <= SignalKind.values().length; n++) {
            overlap.put(n, 0L);
        }

        for (Map.Entry<String, List<SignalHit>> e : byProvider.entrySet()) {
            FlaggedProviderReport report = buildReport(dataset, e.getKey(), e.getValue());
            reports.add(report);
            for (SignalKind kind : report.getSignalKinds()) {
                perKind.merge(kind, 1L, Long::sum);
            }
            overlap.merge(report.getSignalKinds().size(), 1L, Long::sum);
        }

        Map<String, Long> signalCounts = new LinkedHashMap<>();
        for (SignalKind kind : SignalKind.values()) {
            signalCounts.put(kind.getId(), perKind.getOrDefault(kind, 0L));
        }

        LOG.info("Composed {} flagged provider report(s) from {} hit(s); overlap={}",
                reports.size(), hits.size() - dropped, overlap);
        return new FraudScanReport(clock.instant(), dataset.getProvidersScanned(), signalCounts,
                overlap, failedSignals, reports, ExecutionMetrics.NONE);
    }

    private FlaggedProviderReport buildReport(ResolvedDataset dataset, String npi, List<SignalHit> hits) {
        List<SignalHit> ordered = new ArrayList<>(hits);
        ordered.sort(Comparator.comparing(SignalHit::getKind));

        ProviderView view = dataset.getView(npi).orElse(null);
        RegistryEntity registry = dataset.getRegistryEntity(npi).orElse(null);
        String state = registry != null ? registry.getState().orElse(null) : null;

        List<SignalEvidence> signals = new ArrayList<>(ordered.size());
        double overpayment = 0;
        Severity highest = null;
        for (SignalHit hit : ordered) {
            signals.add(new SignalEvidence(hit, FcaCatalog.relevanceFor(hit, state)));
            overpayment += hit.getEstimatedOverpayment();
            highest = hit.getSeverity().max(highest);
        }
        SignalHit primary = ordered.stream().min(PRIMARY_ORDER).orElseThrow();

        FlaggedProviderReport.Builder builder = FlaggedProviderReport.builder()
                .npi(npi)
                .providerName(displayName(dataset, npi, registry))
                .signals(signals)
                .estimatedOverpaymentUsd(overpayment)
                .highestSeverity(highest)
                .fcaRelevance(FcaCatalog.relevanceFor(primary, state));
        if (registry != null) {
            builder.entityType(registry.getEntityType())
                    .taxonomyCode(registry.getTaxonomyCode().orElse(null))
                    .state(state)
                    .enumerationDate(registry.getEnumerationDate().orElse(null));
        }
        if (view != null) {
            builder.totalPaidAllTime(view.getTotalPaid())
                    .totalClaimsAllTime(view.getClaims().getTotalClaims())
                    .totalUniqueBeneficiariesAllTime(view.getClaims().getTotalUniqueBeneficiaries());
        }
        return builder.build();
    }

    private static String displayName(ResolvedDataset dataset, String npi, RegistryEntity registry) {
        if (registry != null && registry.getName() != null) {
            return registry.getName();
        }
        return dataset.getExclusion(npi)
                .map(ExclusionRecord::getName)
                .orElse("Unknown");
    }
}
