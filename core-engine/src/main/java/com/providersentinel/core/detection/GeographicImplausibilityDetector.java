package com.providersentinel.core.detection;

import com.providersentinel.core.model.Claim;
import com.providersentinel.core.model.RegistryEntity;
import com.providersentinel.core.model.Severity;
import com.providersentinel.core.model.SignalHit;
import com.providersentinel.core.model.SignalKind;
import com.providersentinel.core.model.SignalRule;
import com.providersentinel.core.resolve.ResolvedDataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Home-health billing spread over implausibly few beneficiaries.
 *
 * <p>
 * Only claims with a code in {@link HcpcsRange#HOME_HEALTH} count. For every
 * provider-month with strictly more than {@code minMonthlyClaims} such
 * claims, the ratio of distinct beneficiaries to claims is computed; a ratio
 * strictly below {@code maxBeneficiaryRatio} flags the month. A provider
 * receives a single hit describing its lowest-ratio flagged month (the
 * earliest on ties). No overpayment is estimated for this signal.
 * </p>
 *
 * @since 1.0.0
 */
public class GeographicImplausibilityDetector implements SignalDetector {

    private static final Logger LOG = LoggerFactory.getLogger(GeographicImplausibilityDetector.class);

    private final String ruleName;
    private final int minMonthlyClaims;
    private final double maxBeneficiaryRatio;

    /**
     * @param rule the signal rule configuration
     * @throws NullPointerException if {@code rule} or its name is {@code null}
     */
    public GeographicImplausibilityDetector(SignalRule rule) {
        Objects.requireNonNull(rule, "SignalRule must not be null");
        this.ruleName = Objects.requireNonNull(rule.getName(), "Rule name must not be null");
        this.minMonthlyClaims = rule.getMinMonthlyClaims();
        this.maxBeneficiaryRatio = rule.getMaxBeneficiaryRatio();
    }

    @Override
    public List<SignalHit> detect(ResolvedDataset dataset) {
        Objects.requireNonNull(dataset, "dataset must not be null");

        Map<String, Map<YearMonth, MonthTally>> tallies = new TreeMap<>();
        for (Claim claim : dataset.getClaims()) {
            if (!HcpcsRange.isHomeHealth(claim.getProcedureCode())) {
                continue;
            }
            tallies.computeIfAbsent(claim.getBillingProviderId(), k -> new TreeMap<>())
                    .computeIfAbsent(claim.getServiceMonth(), k -> new MonthTally())
                    .add(claim);
        }

        List<SignalHit> hits = new ArrayList<>();
        for (Map.Entry<String, Map<YearMonth, MonthTally>> provider : tallies.entrySet()) {
            YearMonth worstMonth = null;
            MonthTally worst = null;
            int flaggedMonths = 0;
            Set<String> flaggedCodes = new TreeSet<>();
            for (Map.Entry<YearMonth, MonthTally> month : provider.getValue().entrySet()) {
                MonthTally tally = month.getValue();
                if (tally.claims <= minMonthlyClaims || tally.ratio() >= maxBeneficiaryRatio) {
                    continue;
                }
                flaggedMonths++;
                flaggedCodes.addAll(tally.codes);
                if (worst == null || tally.ratio() < worst.ratio()) {
                    worst = tally;
                    worstMonth = month.getKey();
                }
            }
            if (worst == null) {
                continue;
            }

            String providerId = provider.getKey();
            String state = dataset.getRegistryEntity(providerId)
                    .flatMap(RegistryEntity::getState)
                    .orElse(null);
            LOG.debug("Rule [{}] fired: provider={} month={} claims={} beneficiaries={} ratio={}",
                    ruleName, providerId, worstMonth, worst.claims, worst.beneficiaries.size(), worst.ratio());
            hits.add(SignalHit.builder()
                    .providerId(providerId)
                    .kind(SignalKind.GEOGRAPHIC_IMPLAUSIBILITY)
                    .severity(Severity.MEDIUM)
                    .evidence("state", state)
                    .evidence("hcpcs_codes", List.copyOf(flaggedCodes))
                    .evidence("flagged_month", worstMonth)
                    .evidence("claims_count", worst.claims)
                    .evidence("unique_beneficiaries", worst.beneficiaries.size())
                    .evidence("beneficiary_to_claims_ratio", worst.ratio())
                    .evidence("flagged_month_count", flaggedMonths)
                    .build());
        }
        LOG.info("Rule [{}]: {} home-health provider(s) below beneficiary ratio {}",
                ruleName, hits.size(), maxBeneficiaryRatio);
        return hits;
    }

    @Override
    public SignalKind getKind() {
        return SignalKind.GEOGRAPHIC_IMPLAUSIBILITY;
    }

    @Override
    public String getRuleName() {
        return ruleName;
    }

    /** Home-health claims of one provider in one month. */
    private static final class MonthTally {

        private int claims;
        private final Set<String> beneficiaries = new HashSet<>();
        private final Set<String> codes = new TreeSet<>();

        void add(Claim claim) {
            claims++;
            if (claim.getBeneficiaryId() != null) {
                beneficiaries.add(claim.getBeneficiaryId());
            }
            codes.add(claim.getProcedureCode().trim().toUpperCase(Locale.ROOT));
        }

        double ratio() {
            return (double) beneficiaries.size() / claims;
        }
    }
}
