package com.providersentinel.core.model;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

/**
 * One row of the exclusion list (entities barred from program billing).
 *
 * <p>
 * Dates are already normalised by the loader: an all-zero source date arrives
 * here as {@code null}. An absent reinstatement date means the provider was
 * never reinstated.
 * </p>
 *
 * @since 1.0.0
 */
public final class ExclusionRecord {

    private final String providerId;
    private final LocalDate exclusionDate;
    private final LocalDate reinstatementDate;
    private final String exclusionType;
    private final String name;
    private final String state;

    private ExclusionRecord(Builder builder) {
        this.providerId = builder.providerId;
        this.exclusionDate = builder.exclusionDate;
        this.reinstatementDate = builder.reinstatementDate;
        this.exclusionType = builder.exclusionType;
        this.name = builder.name;
        this.state = builder.state;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String providerId;
        private LocalDate exclusionDate;
        private LocalDate reinstatementDate;
        private String exclusionType;
        private String name;
        private String state;

        public Builder providerId(String providerId) {
            this.providerId = providerId;
            return this;
        }

        public Builder exclusionDate(LocalDate exclusionDate) {
            this.exclusionDate = exclusionDate;
            return this;
        }

        public Builder reinstatementDate(LocalDate reinstatementDate) {
            this.reinstatementDate = reinstatementDate;
            return this;
        }

        public Builder exclusionType(String exclusionType) {
            this.exclusionType = exclusionType;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder state(String state) {
            this.state = state;
            return this;
        }

        public ExclusionRecord build() {
            return new ExclusionRecord(this);
        }
    }

    /**
     * @return the provider identifier, empty for rows listed by name only
     */
    public Optional<String> getProviderId() {
        return Optional.ofNullable(providerId);
    }

    public Optional<LocalDate> getExclusionDate() {
        return Optional.ofNullable(exclusionDate);
    }

    public Optional<LocalDate> getReinstatementDate() {
        return Optional.ofNullable(reinstatementDate);
    }

    public String getExclusionType() {
        return exclusionType;
    }

    public String getName() {
        return name;
    }

    public String getState() {
        return state;
    }

    /**
     * Decide whether a service performed on {@code serviceDate} falls inside
     * the exclusion period: strictly after the exclusion date and, when the
     * provider was reinstated, strictly before the reinstatement date.
     *
     * @param serviceDate date of service
     * @return {@code true} if the service was billed while excluded
     */
    public boolean isExcludedOn(LocalDate serviceDate) {
        Objects.requireNonNull(serviceDate, "serviceDate must not be null");
        if (exclusionDate == null || !serviceDate.isAfter(exclusionDate)) {
            return false;
        }
        return reinstatementDate == null || serviceDate.isBefore(reinstatementDate);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ExclusionRecord that))
            return false;
        return Objects.equals(providerId, that.providerId)
                && Objects.equals(exclusionDate, that.exclusionDate)
                && Objects.equals(reinstatementDate, that.reinstatementDate)
                && Objects.equals(exclusionType, that.exclusionType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(providerId, exclusionDate, reinstatementDate, exclusionType);
    }

    @Override
    public String toString() {
        return "ExclusionRecord{" +
                "providerId='" + providerId + '\'' +
                ", exclusionDate=" + exclusionDate +
                ", reinstatementDate=" + reinstatementDate +
                ", exclusionType='" + exclusionType + '\'' +
                '}';
    }
}
