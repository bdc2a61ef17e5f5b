package com.providersentinel.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single detector finding against one provider.
 *
 * <p>
 * Produced by exactly one detector. A provider may receive several hits,
 * from the same or different detectors; they are merged by the report
 * composer, not here.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code providerId}, {@code kind} and
 * {@code severity} are required; omitting any of them throws
 * {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
public final class SignalHit {

    private final String providerId;
    private final SignalKind kind;
    private final Severity severity;

    /** Ordered evidence payload; insertion order is the rendering order. */
    private final Map<String, Object> evidence;

    /** Detector-specific overpayment estimate in USD, never negative. */
    private final double estimatedOverpayment;

    private SignalHit(Builder builder) {
        this.providerId = Objects.requireNonNull(builder.providerId, "providerId must not be null");
        this.kind = Objects.requireNonNull(builder.kind, "kind must not be null");
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.evidence = Collections.unmodifiableMap(new LinkedHashMap<>(builder.evidence));
        this.estimatedOverpayment = Math.max(0, builder.estimatedOverpayment);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link SignalHit} instances.
     */
    public static class Builder {
        private String providerId;
        private SignalKind kind;
        private Severity severity;
        private final Map<String, Object> evidence = new LinkedHashMap<>();
        private double estimatedOverpayment;

        public Builder providerId(String providerId) {
            this.providerId = providerId;
            return this;
        }

        public Builder kind(SignalKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        /**
         * Append one evidence entry. Entries keep their insertion order.
         */
        public Builder evidence(String key, Object value) {
            this.evidence.put(Objects.requireNonNull(key, "Evidence key must not be null"), value);
            return this;
        }

        public Builder evidence(Map<String, Object> entries) {
            entries.forEach(this::evidence);
            return this;
        }

        public Builder estimatedOverpayment(double estimatedOverpayment) {
            this.estimatedOverpayment = estimatedOverpayment;
            return this;
        }

        public SignalHit build() {
            return new SignalHit(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getProviderId() {
        return providerId;
    }

    public SignalKind getKind() {
        return kind;
    }

    public Severity getSeverity() {
        return severity;
    }

    /**
     * @return unmodifiable, insertion-ordered evidence map
     */
    public Map<String, Object> getEvidence() {
        return evidence;
    }

    public double getEstimatedOverpayment() {
        return estimatedOverpayment;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SignalHit hit))
            return false;
        return providerId.equals(hit.providerId)
                && kind == hit.kind
                && severity == hit.severity
                && Double.compare(estimatedOverpayment, hit.estimatedOverpayment) == 0
                && evidence.equals(hit.evidence);
    }

    @Override
    public int hashCode() {
        return Objects.hash(providerId, kind, severity, evidence, estimatedOverpayment);
    }

    @Override
    public String toString() {
        return "SignalHit{" +
                "providerId='" + providerId + '\'' +
                ", kind=" + kind +
                ", severity=" + severity +
                ", estimatedOverpayment=" + estimatedOverpayment +
                '}';
    }
}
