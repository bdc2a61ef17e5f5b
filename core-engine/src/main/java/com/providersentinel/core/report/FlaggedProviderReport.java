package com.providersentinel.core.report;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.providersentinel.core.model.EntityType;
import com.providersentinel.core.model.Severity;
import com.providersentinel.core.model.SignalKind;

import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Final record of one flagged provider, aggregating all of its signal hits.
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code npi}, {@code highestSeverity} and
 * {@code fcaRelevance} are required, and at least one signal must be
 * present.
 * </p>
 *
 * @since 1.0.0
 */
public final class FlaggedProviderReport {

    private final String npi;
    private final String providerName;
    private final EntityType entityType;
    private final String taxonomyCode;
    private final String state;
    private final LocalDate enumerationDate;
    private final double totalPaidAllTime;
    private final long totalClaimsAllTime;
    private final long totalUniqueBeneficiariesAllTime;
    private final List<SignalEvidence> signals;
    private final double estimatedOverpaymentUsd;
    private final Severity highestSeverity;
    private final FcaRelevance fcaRelevance;

    private FlaggedProviderReport(Builder builder) {
        this.npi = Objects.requireNonNull(builder.npi, "npi must not be null");
        this.providerName = builder.providerName != null ? builder.providerName : "Unknown";
        this.entityType = builder.entityType != null ? builder.entityType : EntityType.UNKNOWN;
        this.taxonomyCode = builder.taxonomyCode;
        this.state = builder.state;
        this.enumerationDate = builder.enumerationDate;
        this.totalPaidAllTime = builder.totalPaidAllTime;
        this.totalClaimsAllTime = builder.totalClaimsAllTime;
        this.totalUniqueBeneficiariesAllTime = builder.totalUniqueBeneficiariesAllTime;
        this.signals = List.copyOf(builder.signals);
        if (signals.isEmpty()) {
            throw new IllegalArgumentException("A flagged provider needs at least one signal: " + npi);
        }
        this.estimatedOverpaymentUsd = builder.estimatedOverpaymentUsd;
        this.highestSeverity = Objects.requireNonNull(builder.highestSeverity, "highestSeverity must not be null");
        this.fcaRelevance = Objects.requireNonNull(builder.fcaRelevance, "fcaRelevance must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link FlaggedProviderReport} instances.
     */
    public static class Builder {
        private String npi;
        private String providerName;
        private EntityType entityType;
        private String taxonomyCode;
        private String state;
        private LocalDate enumerationDate;
        private double totalPaidAllTime;
        private long totalClaimsAllTime;
        private long totalUniqueBeneficiariesAllTime;
        private List<SignalEvidence> signals = List.of();
        private double estimatedOverpaymentUsd;
        private Severity highestSeverity;
        private FcaRelevance fcaRelevance;

        public Builder npi(String npi) {
            this.npi = npi;
            return this;
        }

        public Builder providerName(String providerName) {
            this.providerName = providerName;
            return this;
        }

        public Builder entityType(EntityType entityType) {
            this.entityType = entityType;
            return this;
        }

        public Builder taxonomyCode(String taxonomyCode) {
            this.taxonomyCode = taxonomyCode;
            return this;
        }

        public Builder state(String state) {
            this.state = state;
            return this;
        }

        public Builder enumerationDate(LocalDate enumerationDate) {
            this.enumerationDate = enumerationDate;
            return this;
        }

        public Builder totalPaidAllTime(double totalPaidAllTime) {
            this.totalPaidAllTime = totalPaidAllTime;
            return this;
        }

        public Builder totalClaimsAllTime(long totalClaimsAllTime) {
            this.totalClaimsAllTime = totalClaimsAllTime;
            return this;
        }

        public Builder totalUniqueBeneficiariesAllTime(long totalUniqueBeneficiariesAllTime) {
            this.totalUniqueBeneficiariesAllTime = totalUniqueBeneficiariesAllTime;
            return this;
        }

        public Builder signals(List<SignalEvidence> signals) {
            this.signals = Objects.requireNonNull(signals, "signals must not be null");
            return this;
        }

        public Builder estimatedOverpaymentUsd(double estimatedOverpaymentUsd) {
            this.estimatedOverpaymentUsd = estimatedOverpaymentUsd;
            return this;
        }

        public Builder highestSeverity(Severity highestSeverity) {
            this.highestSeverity = highestSeverity;
            return this;
        }

        public Builder fcaRelevance(FcaRelevance fcaRelevance) {
            this.fcaRelevance = fcaRelevance;
            return this;
        }

        public FlaggedProviderReport build() {
            return new FlaggedProviderReport(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getNpi() {
        return npi;
    }

    public String getProviderName() {
        return providerName;
    }

    public EntityType getEntityType() {
        return entityType;
    }

    public String getTaxonomyCode() {
        return taxonomyCode;
    }

    public String getState() {
        return state;
    }

    public LocalDate getEnumerationDate() {
        return enumerationDate;
    }

    public double getTotalPaidAllTime() {
        return totalPaidAllTime;
    }

    public long getTotalClaimsAllTime() {
        return totalClaimsAllTime;
    }

    public long getTotalUniqueBeneficiariesAllTime() {
        return totalUniqueBeneficiariesAllTime;
    }

    public List<SignalEvidence> getSignals() {
        return signals;
    }

    public double getEstimatedOverpaymentUsd() {
        return estimatedOverpaymentUsd;
    }

    public Severity getHighestSeverity() {
        return highestSeverity;
    }

    public FcaRelevance getFcaRelevance() {
        return fcaRelevance;
    }

    /**
     * @return the distinct signal kinds of this provider
     */
    @JsonIgnore
    public Set<SignalKind> getSignalKinds() {
        Set<SignalKind> kinds = EnumSet.noneOf(SignalKind.class);
        for (SignalEvidence signal : signals) {
            kinds.add(signal.getSignalType());
        }
        return kinds;
    }

    @Override
    public String toString() {
        return "FlaggedProviderReport{" +
                "npi='" + npi + '\'' +
                ", signals=" + getSignalKinds() +
                ", estimatedOverpaymentUsd=" + estimatedOverpaymentUsd +
                ", highestSeverity=" + highestSeverity +
                '}';
    }
}
