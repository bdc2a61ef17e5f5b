package com.providersentinel.core.detection;

import com.providersentinel.core.model.ProviderView;
import com.providersentinel.core.model.Severity;
import com.providersentinel.core.model.SignalHit;
import com.providersentinel.core.model.SignalKind;
import com.providersentinel.core.model.SignalRule;
import com.providersentinel.core.resolve.ResolvedDataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;

/**
 * Rapid billing escalation of a newly enrolled entity.
 *
 * <h3>Eligibility</h3>
 * <p>
 * Providers whose registry enumeration month lies within
 * {@code enrollmentWindowMonths} before the latest claim month observed in
 * the whole dataset (inclusive at both ends).
 * </p>
 *
 * <h3>Growth</h3>
 * <p>
 * The monthly paid series holds billed months only; a month without claims
 * is absent rather than zero. For every billed month preceded by
 * {@code rollingWindowMonths} billed months, growth is
 * {@code (paid - trailingAverage) / trailingAverage}; months whose trailing
 * average is zero are skipped. A provider is flagged when the peak growth
 * exceeds {@code growthThreshold}. The overpayment estimate is the amount
 * paid above the trailing average in every month over the threshold.
 * </p>
 *
 * @since 1.0.0
 */
public class RapidEscalationDetector implements SignalDetector {

    private static final Logger LOG = LoggerFactory.getLogger(RapidEscalationDetector.class);

    /** Peak growth above which a hit is {@link Severity#HIGH} (500%). */
    static final double HIGH_SEVERITY_GROWTH = 5.0;

    private final String ruleName;
    private final int enrollmentWindowMonths;
    private final int rollingWindowMonths;
    private final double growthThreshold;

    /**
     * @param rule the signal rule configuration
     * @throws NullPointerException if {@code rule} or its name is {@code null}
     */
    public RapidEscalationDetector(SignalRule rule) {
        Objects.requireNonNull(rule, "SignalRule must not be null");
        this.ruleName = Objects.requireNonNull(rule.getName(), "Rule name must not be null");
        this.enrollmentWindowMonths = rule.getEnrollmentWindowMonths();
        this.rollingWindowMonths = rule.getRollingWindowMonths();
        this.growthThreshold = rule.getGrowthThreshold();
    }

    @Override
    public List<SignalHit> detect(ResolvedDataset dataset) {
        Objects.requireNonNull(dataset, "dataset must not be null");
        YearMonth latest = dataset.getLatestClaimMonth().orElse(null);
        if (latest == null) {
            return List.of();
        }
        YearMonth earliestEnrollment = latest.minusMonths(enrollmentWindowMonths);

        List<SignalHit> hits = new ArrayList<>();
        int eligible = 0;
        for (ProviderView view : dataset.getProviderViews()) {
            if (!view.getClaims().hasClaims()) {
                continue;
            }
            LocalDate enumerated = view.getRegistry()
                    .flatMap(r -> r.getEnumerationDate())
                    .orElse(null);
            if (enumerated == null) {
                continue;
            }
            YearMonth enumeratedMonth = YearMonth.from(enumerated);
            if (enumeratedMonth.isBefore(earliestEnrollment) || enumeratedMonth.isAfter(latest)) {
                continue;
            }
            eligible++;
            Escalation escalation = measure(view.getClaims().getMonthlyPaid());
            if (escalation == null || escalation.peakGrowth <= growthThreshold) {
                continue;
            }

            LOG.debug("Rule [{}] fired: provider={} enumerated={} peakGrowth={} at {}",
                    ruleName, view.getProviderId(), enumerated, escalation.peakGrowth, escalation.peakMonth);
            hits.add(SignalHit.builder()
                    .providerId(view.getProviderId())
                    .kind(SignalKind.RAPID_ESCALATION)
                    .severity(escalation.peakGrowth > HIGH_SEVERITY_GROWTH ? Severity.HIGH : Severity.MEDIUM)
                    .evidence("enumeration_date", enumerated)
                    .evidence("first_billing_month", escalation.firstMonth)
                    .evidence("monthly_paid", escalation.series)
                    .evidence("peak_growth_pct", escalation.peakGrowth * 100.0)
                    .evidence("peak_month", escalation.peakMonth)
                    .evidence("months_above_threshold", escalation.monthsAbove)
                    .estimatedOverpayment(escalation.excess)
                    .build());
        }
        LOG.info("Rule [{}]: {} rapid escalation(s) among {} newly enrolled provider(s)",
                ruleName, hits.size(), eligible);
        return hits;
    }

    /**
     * @return growth statistics, or {@code null} when no month has a full
     *         trailing window with a non-zero average
     */
    Escalation measure(SortedMap<YearMonth, Double> monthlyPaid) {
        if (monthlyPaid.size() <= rollingWindowMonths) {
            return null;
        }
        List<YearMonth> months = new ArrayList<>(monthlyPaid.keySet());
        List<Double> paid = new ArrayList<>(monthlyPaid.values());

        Escalation result = null;
        for (int i = rollingWindowMonths; i < paid.size(); i++) {
            double windowSum = 0;
            for (int j = i - rollingWindowMonths; j < i; j++) {
                windowSum += paid.get(j);
            }
            double average = windowSum / rollingWindowMonths;
            if (average <= 0) {
                continue;
            }
            double growth = (paid.get(i) - average) / average;
            if (result == null) {
                result = new Escalation(months.get(0));
            }
            if (growth > result.peakGrowth) {
                result.peakGrowth = growth;
                result.peakMonth = months.get(i);
            }
            if (growth > growthThreshold) {
                result.monthsAbove++;
                result.excess += paid.get(i) - average;
            }
        }
        if (result != null) {
            for (int i = 0; i < months.size(); i++) {
                result.series.put(months.get(i).toString(), paid.get(i));
            }
        }
        return result;
    }

    @Override
    public SignalKind getKind() {
        return SignalKind.RAPID_ESCALATION;
    }

    @Override
    public String getRuleName() {
        return ruleName;
    }

    static final class Escalation {

        final YearMonth firstMonth;
        final Map<String, Double> series = new LinkedHashMap<>();
        double peakGrowth = Double.NEGATIVE_INFINITY;
        YearMonth peakMonth;
        int monthsAbove;
        double excess;

        Escalation(YearMonth firstMonth) {
            this.firstMonth = firstMonth;
        }
    }
}
