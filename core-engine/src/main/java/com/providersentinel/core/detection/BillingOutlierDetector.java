package com.providersentinel.core.detection;

import com.providersentinel.core.model.ProviderView;
import com.providersentinel.core.model.RegistryEntity;
import com.providersentinel.core.model.Severity;
import com.providersentinel.core.model.SignalHit;
import com.providersentinel.core.model.SignalKind;
import com.providersentinel.core.model.SignalRule;
import com.providersentinel.core.resolve.ResolvedDataset;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Billing volume outlier against a (taxonomy, state) peer cohort.
 *
 * <p>
 * Only providers with claims and with both a taxonomy code and a state in
 * the registry join a cohort. Cohorts smaller than {@code minPeers} are not
 * evaluated at all. Within a cohort the median and the configured
 * percentile of total paid are computed by linear interpolation between
 * order statistics (Hyndman-Fan R-7, the {@code PERCENTILE_CONT}
 * definition); a provider whose total strictly exceeds the percentile is
 * flagged. The overpayment estimate is the excess over the percentile.
 * </p>
 *
 * @since 1.0.0
 */
public class BillingOutlierDetector implements SignalDetector {

    private static final Logger LOG = LoggerFactory.getLogger(BillingOutlierDetector.class);

    /** Ratio to the cohort median above which a hit is {@link Severity#HIGH}. */
    static final double HIGH_SEVERITY_MEDIAN_RATIO = 5.0;

    private final String ruleName;
    private final double percentile;
    private final int minPeers;

    /**
     * @param rule the signal rule configuration
     * @throws NullPointerException if {@code rule} or its name is {@code null}
     */
    public BillingOutlierDetector(SignalRule rule) {
        Objects.requireNonNull(rule, "SignalRule must not be null");
        this.ruleName = Objects.requireNonNull(rule.getName(), "Rule name must not be null");
        this.percentile = rule.getPercentile();
        this.minPeers = rule.getMinPeers();
    }

    @Override
    public List<SignalHit> detect(ResolvedDataset dataset) {
        Objects.requireNonNull(dataset, "dataset must not be null");

        Map<PeerCohortKey, List<ProviderView>> cohorts = new TreeMap<>();
        for (ProviderView view : dataset.getProviderViews()) {
            if (!view.getClaims().hasClaims()) {
                continue;
            }
            RegistryEntity entity = view.getRegistry().orElse(null);
            if (entity == null || entity.getTaxonomyCode().isEmpty() || entity.getState().isEmpty()) {
                continue;
            }
            PeerCohortKey key = new PeerCohortKey(entity.getTaxonomyCode().get(), entity.getState().get());
            cohorts.computeIfAbsent(key, k -> new ArrayList<>()).add(view);
        }

        List<SignalHit> hits = new ArrayList<>();
        int evaluated = 0;
        for (Map.Entry<PeerCohortKey, List<ProviderView>> cohort : cohorts.entrySet()) {
            List<ProviderView> members = cohort.getValue();
            if (members.size() < minPeers) {
                LOG.trace("Rule [{}]: cohort {} has {} member(s), below floor of {}, skipping",
                        ruleName, cohort.getKey(), members.size(), minPeers);
                continue;
            }
            evaluated++;
            hits.addAll(evaluateCohort(cohort.getKey(), members));
        }
        hits.sort(Comparator.comparing(SignalHit::getProviderId));

        LOG.info("Rule [{}]: {} outlier(s) across {} qualifying cohort(s) of {}",
                ruleName, hits.size(), evaluated, cohorts.size());
        return hits;
    }

    private List<SignalHit> evaluateCohort(PeerCohortKey key, List<ProviderView> members) {
        double[] totals = new double[members.size()];
        for (int i = 0; i < totals.length; i++) {
            totals[i] = members.get(i).getTotalPaid();
        }
        Percentile estimator = new Percentile().withEstimationType(EstimationType.R_7);
        estimator.setData(totals);
        double median = estimator.evaluate(50.0);
        double threshold = estimator.evaluate(percentile);

        List<SignalHit> hits = new ArrayList<>();
        for (ProviderView view : members) {
            double total = view.getTotalPaid();
            if (total <= threshold) {
                continue;
            }
            Double ratioToThreshold = threshold > 0 ? total / threshold : null;
            Double ratioToMedian = median > 0 ? total / median : null;
            Severity severity = ratioToMedian != null && ratioToMedian > HIGH_SEVERITY_MEDIAN_RATIO
                    ? Severity.HIGH
                    : Severity.MEDIUM;

            LOG.debug("Rule [{}] fired: provider={} cohort={} total={} p{}={} median={}",
                    ruleName, view.getProviderId(), key, total, percentile, threshold, median);
            hits.add(SignalHit.builder()
                    .providerId(view.getProviderId())
                    .kind(SignalKind.BILLING_OUTLIER)
                    .severity(severity)
                    .evidence("total_paid", total)
                    .evidence("taxonomy_code", key.getTaxonomyCode())
                    .evidence("state", key.getState())
                    .evidence("cohort_size", members.size())
                    .evidence("peer_median", median)
                    .evidence("peer_percentile", percentile)
                    .evidence("peer_percentile_value", threshold)
                    .evidence("ratio_to_percentile", ratioToThreshold)
                    .evidence("ratio_to_median", ratioToMedian)
                    .estimatedOverpayment(total - threshold)
                    .build());
        }
        return hits;
    }

    @Override
    public SignalKind getKind() {
        return SignalKind.BILLING_OUTLIER;
    }

    @Override
    public String getRuleName() {
        return ruleName;
    }
}
