package com.providersentinel.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Describes one signal detector and its thresholds, loaded from
 * configuration.
 *
 * <p>
 * Supported rule types (one per {@link SignalKind}):
 * </p>
 * <ul>
 * <li>{@code excluded_provider}: billing during an exclusion period</li>
 * <li>{@code billing_outlier}: total paid above a peer-cohort percentile</li>
 * <li>{@code rapid_escalation}: growth of a newly enrolled entity</li>
 * <li>{@code workforce_impossibility}: claims per working hour</li>
 * <li>{@code shared_official}: many organizations behind one official</li>
 * <li>{@code geographic_implausibility}: home-health claims per
 * beneficiary</li>
 * </ul>
 *
 * <p>
 * Every threshold has a default, so a rule only needs {@code name} and
 * {@code type}. Call {@link #validate()} after deserialization to verify the
 * fields the declared type uses.
 * </p>
 *
 * @since 1.0.0
 */
public class SignalRule {

    /** Unique rule name used in logs. */
    private String name;

    /** Rule type: the {@link SignalKind} identifier. */
    private String type;

    private boolean enabled = true;

    // --- Billing outlier ---
    /** Cohort percentile (0, 100] a provider must exceed. */
    private double percentile = 99.0;

    /** Cohorts with fewer members are not evaluated. */
    private int minPeers = 10;

    // --- Rapid escalation ---
    /** Enumeration must fall within this many months of the latest claim month. */
    private int enrollmentWindowMonths = 24;

    /** Length of the trailing average window, in months. */
    private int rollingWindowMonths = 3;

    /** Growth ratio that must be exceeded (2.0 = 200%). */
    private double growthThreshold = 2.0;

    // --- Workforce impossibility ---
    private double maxClaimsPerHour = 6.0;
    private int workingDaysPerMonth = 22;
    private int hoursPerDay = 8;

    // --- Shared official ---
    private int minMembers = 5;
    private double minCombinedPaid = 1_000_000;

    // --- Geographic implausibility ---
    /** Provider-months need strictly more home-health claims than this. */
    private int minMonthlyClaims = 100;

    /** Beneficiary-to-claim ratio must be strictly below this. */
    private double maxBeneficiaryRatio = 0.1;

    /**
     * Create a rule of the given kind with every threshold at its default.
     *
     * @param kind the signal kind
     * @return new rule named after the kind
     */
    public static SignalRule of(SignalKind kind) {
        Objects.requireNonNull(kind, "kind must not be null");
        SignalRule rule = new SignalRule();
        rule.setName(kind.getId());
        rule.setType(kind.getId());
        return rule;
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that the fields used by the declared rule type hold legal
     * values.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (name == null || name.isBlank()) {
            errors.add("Rule 'name' is required");
        }
        if (type == null || type.isBlank()) {
            errors.add("Rule 'type' is required");
        }

        if (type != null) {
            switch (type) {
                case "excluded_provider" -> {
                    // no thresholds
                }
                case "billing_outlier" -> {
                    if (percentile <= 0 || percentile > 100) {
                        errors.add("Billing outlier rule '" + name + "' requires 'percentile' in (0, 100]");
                    }
                    if (minPeers < 1) {
                        errors.add("Billing outlier rule '" + name + "' requires 'minPeers' >= 1");
                    }
                }
                case "rapid_escalation" -> {
                    if (enrollmentWindowMonths <= 0) {
                        errors.add("Rapid escalation rule '" + name + "' requires 'enrollmentWindowMonths' > 0");
                    }
                    if (rollingWindowMonths < 1) {
                        errors.add("Rapid escalation rule '" + name + "' requires 'rollingWindowMonths' >= 1");
                    }
                    if (growthThreshold <= 0) {
                        errors.add("Rapid escalation rule '" + name + "' requires 'growthThreshold' > 0");
                    }
                }
                case "workforce_impossibility" -> {
                    if (maxClaimsPerHour <= 0) {
                        errors.add("Workforce rule '" + name + "' requires 'maxClaimsPerHour' > 0");
                    }
                    if (workingDaysPerMonth <= 0 || hoursPerDay <= 0) {
                        errors.add("Workforce rule '" + name
                                + "' requires 'workingDaysPerMonth' and 'hoursPerDay' > 0");
                    }
                }
                case "shared_official" -> {
                    if (minMembers < 2) {
                        errors.add("Shared official rule '" + name + "' requires 'minMembers' >= 2");
                    }
                    if (minCombinedPaid < 0) {
                        errors.add("Shared official rule '" + name + "' requires 'minCombinedPaid' >= 0");
                    }
                }
                case "geographic_implausibility" -> {
                    if (minMonthlyClaims < 0) {
                        errors.add("Geographic rule '" + name + "' requires 'minMonthlyClaims' >= 0");
                    }
                    if (maxBeneficiaryRatio <= 0) {
                        errors.add("Geographic rule '" + name + "' requires 'maxBeneficiaryRatio' > 0");
                    }
                }
                default -> errors.add("Unknown rule type: '" + type
                        + "'. Supported: excluded_provider, billing_outlier, rapid_escalation, "
                        + "workforce_impossibility, shared_official, geographic_implausibility");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid SignalRule: " + String.join("; ", errors));
        }
    }

    /**
     * @return the signal kind named by {@link #getType()}
     * @throws IllegalArgumentException if the type is unknown
     */
    public SignalKind getKind() {
        return SignalKind.fromId(type);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getType() {
        return type;
    }

    /**
     * Set the rule type, normalised to lowercase.
     *
     * @param type rule type string
     */
    public void setType(String type) {
        this.type = type != null ? type.trim().toLowerCase(Locale.ROOT) : null;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public double getPercentile() {
        return percentile;
    }

    public void setPercentile(double percentile) {
        this.percentile = percentile;
    }

    public int getMinPeers() {
        return minPeers;
    }

    public void setMinPeers(int minPeers) {
        this.minPeers = minPeers;
    }

    public int getEnrollmentWindowMonths() {
        return enrollmentWindowMonths;
    }

    public void setEnrollmentWindowMonths(int enrollmentWindowMonths) {
        this.enrollmentWindowMonths = enrollmentWindowMonths;
    }

    public int getRollingWindowMonths() {
        return rollingWindowMonths;
    }

    public void setRollingWindowMonths(int rollingWindowMonths) {
        this.rollingWindowMonths = rollingWindowMonths;
    }

    public double getGrowthThreshold() {
        return growthThreshold;
    }

    public void setGrowthThreshold(double growthThreshold) {
        this.growthThreshold = growthThreshold;
    }

    public double getMaxClaimsPerHour() {
        return maxClaimsPerHour;
    }

    public void setMaxClaimsPerHour(double maxClaimsPerHour) {
        this.maxClaimsPerHour = maxClaimsPerHour;
    }

    public int getWorkingDaysPerMonth() {
        return workingDaysPerMonth;
    }

    public void setWorkingDaysPerMonth(int workingDaysPerMonth) {
        this.workingDaysPerMonth = workingDaysPerMonth;
    }

    public int getHoursPerDay() {
        return hoursPerDay;
    }

    public void setHoursPerDay(int hoursPerDay) {
        this.hoursPerDay = hoursPerDay;
    }

    public int getMinMembers() {
        return minMembers;
    }

    public void setMinMembers(int minMembers) {
        this.minMembers = minMembers;
    }

    public double getMinCombinedPaid() {
        return minCombinedPaid;
    }

    public void setMinCombinedPaid(double minCombinedPaid) {
        this.minCombinedPaid = minCombinedPaid;
    }

    public int getMinMonthlyClaims() {
        return minMonthlyClaims;
    }

    public void setMinMonthlyClaims(int minMonthlyClaims) {
        this.minMonthlyClaims = minMonthlyClaims;
    }

    public double getMaxBeneficiaryRatio() {
        return maxBeneficiaryRatio;
    }

    public void setMaxBeneficiaryRatio(double maxBeneficiaryRatio) {
        this.maxBeneficiaryRatio = maxBeneficiaryRatio;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SignalRule that))
            return false;
        return Objects.equals(name, that.name) && Objects.equals(type, that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return "SignalRule{" +
                "name='" + name + '\'' +
                ", type='" + type + '\'' +
                ", enabled=" + enabled +
                '}';
    }
}
