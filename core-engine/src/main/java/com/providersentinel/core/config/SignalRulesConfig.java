package com.providersentinel.core.config;

import com.providersentinel.core.model.SignalKind;
import com.providersentinel.core.model.SignalRule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Top-level POJO for the signal rules YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * rules:
 *   - name: billing_outlier
 *     type: billing_outlier
 *     percentile: 99
 *     minPeers: 10
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading to verify every rule is valid.
 * </p>
 *
 * @since 1.0.0
 */
public class SignalRulesConfig {

    private List<SignalRule> rules = new ArrayList<>();

    /**
     * Build a configuration holding one default rule per {@link SignalKind}.
     *
     * @return configuration enabling all six detectors with default thresholds
     */
    public static SignalRulesConfig defaults() {
        List<SignalRule> all = new ArrayList<>();
        for (SignalKind kind : SignalKind.values()) {
            all.add(SignalRule.of(kind));
        }
        SignalRulesConfig config = new SignalRulesConfig();
        config.setRules(all);
        return config;
    }

    /**
     * Return the rules list. The returned list is <strong>unmodifiable</strong>.
     *
     * @return unmodifiable list of signal rules
     */
    public List<SignalRule> getRules() {
        return Collections.unmodifiableList(rules);
    }

    /**
     * Set the rules list (used by SnakeYAML during deserialization).
     *
     * @param rules the signal rules
     */
    public void setRules(List<SignalRule> rules) {
        this.rules = rules != null ? new ArrayList<>(rules) : new ArrayList<>();
    }

    /**
     * @return the enabled rules, in configuration order
     */
    public List<SignalRule> getEnabledRules() {
        return rules.stream().filter(SignalRule::isEnabled).toList();
    }

    /**
     * Validate every rule in this configuration.
     *
     * <p>
     * Delegates to {@link SignalRule#validate()} for each rule and rejects a
     * signal type declared more than once. Collects all errors and throws a
     * single exception if any rule is invalid.
     * </p>
     *
     * @throws IllegalStateException if one or more rules are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        Set<SignalKind> seen = EnumSet.noneOf(SignalKind.class);

        for (int i = 0; i < rules.size(); i++) {
            SignalRule rule = Objects.requireNonNull(rules.get(i),
                    "Rule at index " + i + " is null");
            try {
                rule.validate();
                if (!seen.add(rule.getKind())) {
                    errors.add("Signal type '" + rule.getType() + "' is declared more than once");
                }
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Signal rules configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    @Override
    public String toString() {
        return "SignalRulesConfig{rules=" + rules + '}';
    }
}
