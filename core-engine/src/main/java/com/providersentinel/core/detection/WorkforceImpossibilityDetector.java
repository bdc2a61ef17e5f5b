package com.providersentinel.core.detection;

import com.providersentinel.core.model.ClaimAggregate;
import com.providersentinel.core.model.ProviderView;
import com.providersentinel.core.model.Severity;
import com.providersentinel.core.model.SignalHit;
import com.providersentinel.core.model.SignalKind;
import com.providersentinel.core.model.SignalRule;
import com.providersentinel.core.resolve.ResolvedDataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Workforce impossibility for organizations.
 *
 * <p>
 * The implied rate is the claim count of the organization's peak month
 * divided by {@code workingDaysPerMonth} and {@code hoursPerDay}; a rate
 * strictly above {@code maxClaimsPerHour} is flagged. The overpayment
 * estimate is the number of peak-month claims above capacity times the
 * average paid per claim in that month.
 * </p>
 *
 * @since 1.0.0
 */
public class WorkforceImpossibilityDetector implements SignalDetector {

    private static final Logger LOG = LoggerFactory.getLogger(WorkforceImpossibilityDetector.class);

    private final String ruleName;
    private final double maxClaimsPerHour;
    private final int workingDaysPerMonth;
    private final int hoursPerDay;

    /**
     * @param rule the signal rule configuration
     * @throws NullPointerException if {@code rule} or its name is {@code null}
     */
    public WorkforceImpossibilityDetector(SignalRule rule) {
        Objects.requireNonNull(rule, "SignalRule must not be null");
        this.ruleName = Objects.requireNonNull(rule.getName(), "Rule name must not be null");
        this.maxClaimsPerHour = rule.getMaxClaimsPerHour();
        this.workingDaysPerMonth = rule.getWorkingDaysPerMonth();
        this.hoursPerDay = rule.getHoursPerDay();
    }

    @Override
    public List<SignalHit> detect(ResolvedDataset dataset) {
        Objects.requireNonNull(dataset, "dataset must not be null");
        double monthlyCapacity = maxClaimsPerHour * workingDaysPerMonth * hoursPerDay;

        List<SignalHit> hits = new ArrayList<>();
        for (ProviderView view : dataset.getProviderViews()) {
            if (!view.isOrganization()) {
                continue;
            }
            ClaimAggregate claims = view.getClaims();
            YearMonth peakMonth = claims.getPeakClaimMonth().orElse(null);
            if (peakMonth == null) {
                continue;
            }
            int peakClaims = claims.getMonthlyClaimCount().get(peakMonth);
            double rate = (double) peakClaims / workingDaysPerMonth / hoursPerDay;
            if (rate <= maxClaimsPerHour) {
                continue;
            }
            double peakPaid = claims.getMonthlyPaid().getOrDefault(peakMonth, 0.0);
            double averagePerClaim = peakPaid / peakClaims;

            LOG.debug("Rule [{}] fired: provider={} peakMonth={} claims={} rate={}",
                    ruleName, view.getProviderId(), peakMonth, peakClaims, rate);
            hits.add(SignalHit.builder()
                    .providerId(view.getProviderId())
                    .kind(SignalKind.WORKFORCE_IMPOSSIBILITY)
                    .severity(Severity.HIGH)
                    .evidence("peak_month", peakMonth)
                    .evidence("peak_claims", peakClaims)
                    .evidence("implied_claims_per_hour", rate)
                    .evidence("peak_month_paid", peakPaid)
                    .estimatedOverpayment((peakClaims - monthlyCapacity) * averagePerClaim)
                    .build());
        }
        LOG.info("Rule [{}]: {} organization(s) above {} claims per hour", ruleName, hits.size(), maxClaimsPerHour);
        return hits;
    }

    @Override
    public SignalKind getKind() {
        return SignalKind.WORKFORCE_IMPOSSIBILITY;
    }

    @Override
    public String getRuleName() {
        return ruleName;
    }
}
