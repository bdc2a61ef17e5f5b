package com.providersentinel.core.model;

import java.time.YearMonth;
import java.util.Objects;
import java.util.Optional;

/**
 * One billed-service record from the claims source.
 *
 * <p>
 * Instances are immutable and created by the claims loader. Every downstream
 * stage reads them without modification.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code billingProviderId} and {@code serviceMonth}
 * are required; omitting either throws {@link NullPointerException} at build
 * time.
 * </p>
 *
 * @since 1.0.0
 */
public final class Claim {

    /** Provider that billed the service (join key for the provider view). */
    private final String billingProviderId;

    /** Provider that rendered the service; {@code null} when not reported. */
    private final String servicingProviderId;

    private final YearMonth serviceMonth;
    private final double paidAmount;

    /** HCPCS procedure code, upper-cased. */
    private final String procedureCode;

    private final String beneficiaryId;

    private Claim(Builder builder) {
        this.billingProviderId = Objects.requireNonNull(builder.billingProviderId,
                "billingProviderId must not be null");
        this.servicingProviderId = builder.servicingProviderId;
        this.serviceMonth = Objects.requireNonNull(builder.serviceMonth, "serviceMonth must not be null");
        this.paidAmount = builder.paidAmount;
        this.procedureCode = builder.procedureCode;
        this.beneficiaryId = builder.beneficiaryId;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Claim} instances.
     */
    public static class Builder {
        private String billingProviderId;
        private String servicingProviderId;
        private YearMonth serviceMonth;
        private double paidAmount;
        private String procedureCode;
        private String beneficiaryId;

        public Builder billingProviderId(String billingProviderId) {
            this.billingProviderId = billingProviderId;
            return this;
        }

        public Builder servicingProviderId(String servicingProviderId) {
            this.servicingProviderId = servicingProviderId;
            return this;
        }

        public Builder serviceMonth(YearMonth serviceMonth) {
            this.serviceMonth = serviceMonth;
            return this;
        }

        public Builder paidAmount(double paidAmount) {
            this.paidAmount = paidAmount;
            return this;
        }

        public Builder procedureCode(String procedureCode) {
            this.procedureCode = procedureCode;
            return this;
        }

        public Builder beneficiaryId(String beneficiaryId) {
            this.beneficiaryId = beneficiaryId;
            return this;
        }

        public Claim build() {
            return new Claim(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getBillingProviderId() {
        return billingProviderId;
    }

    public Optional<String> getServicingProviderId() {
        return Optional.ofNullable(servicingProviderId);
    }

    public YearMonth getServiceMonth() {
        return serviceMonth;
    }

    public double getPaidAmount() {
        return paidAmount;
    }

    public String getProcedureCode() {
        return procedureCode;
    }

    public String getBeneficiaryId() {
        return beneficiaryId;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Claim that))
            return false;
        return Double.compare(paidAmount, that.paidAmount) == 0
                && billingProviderId.equals(that.billingProviderId)
                && Objects.equals(servicingProviderId, that.servicingProviderId)
                && serviceMonth.equals(that.serviceMonth)
                && Objects.equals(procedureCode, that.procedureCode)
                && Objects.equals(beneficiaryId, that.beneficiaryId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(billingProviderId, servicingProviderId, serviceMonth, paidAmount,
                procedureCode, beneficiaryId);
    }

    @Override
    public String toString() {
        return "Claim{" +
                "billingProviderId='" + billingProviderId + '\'' +
                ", servicingProviderId='" + servicingProviderId + '\'' +
                ", serviceMonth=" + serviceMonth +
                ", paidAmount=" + paidAmount +
                ", procedureCode='" + procedureCode + '\'' +
                '}';
    }
}
