package com.providersentinel.core.detection;

import com.providersentinel.core.model.SignalRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Factory that creates {@link SignalDetector} instances from
 * {@link SignalRule} configurations.
 *
 * <p>
 * This is the single point of extension when adding new signal kinds:
 * register the new kind here and create the corresponding detector.
 * </p>
 *
 * @since 1.0.0
 */
public final class SignalDetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(SignalDetectorFactory.class);

    private SignalDetectorFactory() {
        // utility class
    }

    /**
     * Create a detector for the given rule.
     *
     * @param rule the signal rule configuration; must not be {@code null}
     * @return an appropriate {@link SignalDetector} instance
     * @throws NullPointerException     if {@code rule} or its type is {@code null}
     * @throws IllegalArgumentException if the rule type is unknown
     */
    public static SignalDetector create(SignalRule rule) {
        Objects.requireNonNull(rule, "SignalRule must not be null");
        Objects.requireNonNull(rule.getType(), "Rule type must not be null");

        return switch (rule.getKind()) {
            case EXCLUDED_PROVIDER -> new ExcludedProviderDetector(rule);
            case BILLING_OUTLIER -> new BillingOutlierDetector(rule);
            case RAPID_ESCALATION -> new RapidEscalationDetector(rule);
            case WORKFORCE_IMPOSSIBILITY -> new WorkforceImpossibilityDetector(rule);
            case SHARED_OFFICIAL -> new SharedOfficialDetector(rule);
            case GEOGRAPHIC_IMPLAUSIBILITY -> new GeographicImplausibilityDetector(rule);
        };
    }

    /**
     * Create detectors for every rule in the supplied list.
     *
     * <p>
     * The returned list is <strong>unmodifiable</strong>.
     * </p>
     *
     * @param rules list of rule configurations; must not be {@code null}
     * @return unmodifiable list of detectors (one per rule)
     * @throws NullPointerException if {@code rules} is {@code null}
     */
    public static List<SignalDetector> createAll(List<SignalRule> rules) {
        Objects.requireNonNull(rules, "Rules list must not be null");
        LOG.info("Creating {} detector(s) from configuration", rules.size());
        List<SignalDetector> detectors = rules.stream()
                .map(SignalDetectorFactory::create)
                .toList();
        return Collections.unmodifiableList(detectors);
    }
}
