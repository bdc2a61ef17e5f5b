package com.providersentinel.core.model;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

/**
 * Provider directory entry from the national registry.
 *
 * <p>
 * The authorized-official name is only populated for organizations.
 * </p>
 *
 * @since 1.0.0
 */
public final class RegistryEntity {

    private final String providerId;
    private final String name;
    private final EntityType entityType;
    private final String taxonomyCode;
    private final String state;
    private final LocalDate enumerationDate;
    private final String officialLastName;
    private final String officialFirstName;

    private RegistryEntity(Builder builder) {
        this.providerId = Objects.requireNonNull(builder.providerId, "providerId must not be null");
        this.name = builder.name;
        this.entityType = builder.entityType != null ? builder.entityType : EntityType.UNKNOWN;
        this.taxonomyCode = builder.taxonomyCode;
        this.state = builder.state;
        this.enumerationDate = builder.enumerationDate;
        this.officialLastName = builder.officialLastName;
        this.officialFirstName = builder.officialFirstName;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String providerId;
        private String name;
        private EntityType entityType;
        private String taxonomyCode;
        private String state;
        private LocalDate enumerationDate;
        private String officialLastName;
        private String officialFirstName;

        public Builder providerId(String providerId) {
            this.providerId = providerId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
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

        public Builder officialLastName(String officialLastName) {
            this.officialLastName = officialLastName;
            return this;
        }

        public Builder officialFirstName(String officialFirstName) {
            this.officialFirstName = officialFirstName;
            return this;
        }

        public RegistryEntity build() {
            return new RegistryEntity(this);
        }
    }

    public String getProviderId() {
        return providerId;
    }

    public String getName() {
        return name;
    }

    public EntityType getEntityType() {
        return entityType;
    }

    public boolean isOrganization() {
        return entityType == EntityType.ORGANIZATION;
    }

    public Optional<String> getTaxonomyCode() {
        return Optional.ofNullable(taxonomyCode);
    }

    public Optional<String> getState() {
        return Optional.ofNullable(state);
    }

    public Optional<LocalDate> getEnumerationDate() {
        return Optional.ofNullable(enumerationDate);
    }

    public Optional<String> getOfficialLastName() {
        return Optional.ofNullable(officialLastName);
    }

    public Optional<String> getOfficialFirstName() {
        return Optional.ofNullable(officialFirstName);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RegistryEntity that))
            return false;
        return providerId.equals(that.providerId);
    }

    @Override
    public int hashCode() {
        return providerId.hashCode();
    }

    @Override
    public String toString() {
        return "RegistryEntity{" +
                "providerId='" + providerId + '\'' +
                ", name='" + name + '\'' +
                ", entityType=" + entityType +
                ", taxonomyCode='" + taxonomyCode + '\'' +
                ", state='" + state + '\'' +
                '}';
    }
}
