package com.providersentinel.core.detection;

import com.providersentinel.core.model.Claim;
import com.providersentinel.core.model.ExclusionRecord;
import com.providersentinel.core.model.Severity;
import com.providersentinel.core.model.SignalHit;
import com.providersentinel.core.model.SignalKind;
import com.providersentinel.core.model.SignalRule;
import com.providersentinel.core.resolve.ProviderIds;
import com.providersentinel.core.resolve.ResolvedDataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Excluded provider still billing.
 *
 * <p>
 * A claim falls in the violation window of an identifier when that
 * identifier (billing or servicing) has an exclusion record with an
 * exclusion date, and the first day of the claim's service month is
 * strictly after the exclusion date and, if a reinstatement date exists,
 * strictly before it. Each identifier with at least one such claim gets one
 * {@link Severity#CRITICAL} hit whose overpayment estimate is the full
 * amount paid inside the window.
 * </p>
 *
 * @since 1.0.0
 */
public class ExcludedProviderDetector implements SignalDetector {

    private static final Logger LOG = LoggerFactory.getLogger(ExcludedProviderDetector.class);

    private final String ruleName;

    /**
     * @param rule the signal rule configuration
     * @throws NullPointerException if {@code rule} or its name is {@code null}
     */
    public ExcludedProviderDetector(SignalRule rule) {
        Objects.requireNonNull(rule, "SignalRule must not be null");
        this.ruleName = Objects.requireNonNull(rule.getName(), "Rule name must not be null");
    }

    @Override
    public List<SignalHit> detect(ResolvedDataset dataset) {
        Objects.requireNonNull(dataset, "dataset must not be null");
        Map<String, ExclusionRecord> exclusions = dataset.getExclusions();
        if (exclusions.isEmpty()) {
            return List.of();
        }

        Map<String, Window> windows = new TreeMap<>();
        for (Claim claim : dataset.getClaims()) {
            LocalDate serviceDate = claim.getServiceMonth().atDay(1);
            String billing = claim.getBillingProviderId();
            accumulate(windows, exclusions, billing, claim, serviceDate);

            String servicing = claim.getServicingProviderId().orElse(null);
            if (servicing != null && !servicing.equals(billing) && ProviderIds.isValid(servicing)) {
                accumulate(windows, exclusions, servicing, claim, serviceDate);
            }
        }

        List<SignalHit> hits = new ArrayList<>(windows.size());
        for (Map.Entry<String, Window> e : windows.entrySet()) {
            Window window = e.getValue();
            ExclusionRecord record = window.record;
            LOG.debug("Rule [{}] fired: provider={} excluded={} paidAfter={}",
                    ruleName, e.getKey(), record.getExclusionDate().orElse(null), window.paid);
            hits.add(SignalHit.builder()
                    .providerId(e.getKey())
                    .kind(SignalKind.EXCLUDED_PROVIDER)
                    .severity(Severity.CRITICAL)
                    .evidence("exclusion_date", record.getExclusionDate().orElse(null))
                    .evidence("exclusion_type", record.getExclusionType())
                    .evidence("reinstatement_date", record.getReinstatementDate().orElse(null))
                    .evidence("first_post_exclusion_month", window.firstMonth)
                    .evidence("post_exclusion_claims", window.claims)
                    .evidence("post_exclusion_paid", window.paid)
                    .estimatedOverpayment(window.paid)
                    .build());
        }
        LOG.info("Rule [{}]: {} excluded provider(s) billing after exclusion", ruleName, hits.size());
        return hits;
    }

    @Override
    public SignalKind getKind() {
        return SignalKind.EXCLUDED_PROVIDER;
    }

    @Override
    public String getRuleName() {
        return ruleName;
    }

    private static void accumulate(Map<String, Window> windows, Map<String, ExclusionRecord> exclusions,
            String providerId, Claim claim, LocalDate serviceDate) {
        ExclusionRecord record = exclusions.get(providerId);
        if (record == null || !record.isExcludedOn(serviceDate)) {
            return;
        }
        windows.computeIfAbsent(providerId, k -> new Window(record)).add(claim);
    }

    /** Claims of one identifier inside its violation window. */
    private static final class Window {

        private final ExclusionRecord record;
        private YearMonth firstMonth;
        private long claims;
        private double paid;

        Window(ExclusionRecord record) {
            this.record = record;
        }

        void add(Claim claim) {
            if (firstMonth == null || claim.getServiceMonth().isBefore(firstMonth)) {
                firstMonth = claim.getServiceMonth();
            }
            claims++;
            paid += claim.getPaidAmount();
        }
    }
}
