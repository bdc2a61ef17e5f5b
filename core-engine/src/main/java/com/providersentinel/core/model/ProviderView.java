package com.providersentinel.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Resolved, provider-centric view: the claim aggregate of one valid
 * identifier joined with its registry entry and exclusion record.
 *
 * <p>
 * Exactly one view exists per valid identifier that has a registry or claims
 * match. Views are immutable and shared read-only by every detector.
 * </p>
 *
 * @since 1.0.0
 */
public final class ProviderView {

    private final String providerId;
    private final ClaimAggregate claims;
    private final RegistryEntity registry;
    private final ExclusionRecord exclusion;

    /**
     * @param providerId valid provider identifier; must not be {@code null}
     * @param claims     claim aggregate, {@link ClaimAggregate#EMPTY} when the
     *                   provider never billed
     * @param registry   registry entry, may be {@code null}
     * @param exclusion  authoritative exclusion record, may be {@code null}
     */
    public ProviderView(String providerId, ClaimAggregate claims,
            RegistryEntity registry, ExclusionRecord exclusion) {
        this.providerId = Objects.requireNonNull(providerId, "providerId must not be null");
        this.claims = claims != null ? claims : ClaimAggregate.EMPTY;
        this.registry = registry;
        this.exclusion = exclusion;
    }

    public String getProviderId() {
        return providerId;
    }

    public ClaimAggregate getClaims() {
        return claims;
    }

    public Optional<RegistryEntity> getRegistry() {
        return Optional.ofNullable(registry);
    }

    public Optional<ExclusionRecord> getExclusion() {
        return Optional.ofNullable(exclusion);
    }

    public double getTotalPaid() {
        return claims.getTotalPaid();
    }

    // ---------------------------------------------------------------
    // Registry shortcuts
    // ---------------------------------------------------------------

    public String getName() {
        return registry != null && registry.getName() != null ? registry.getName() : "Unknown";
    }

    public EntityType getEntityType() {
        return registry != null ? registry.getEntityType() : EntityType.UNKNOWN;
    }

    public boolean isOrganization() {
        return getEntityType() == EntityType.ORGANIZATION;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ProviderView that))
            return false;
        return providerId.equals(that.providerId);
    }

    @Override
    public int hashCode() {
        return providerId.hashCode();
    }

    @Override
    public String toString() {
        return "ProviderView{" +
                "providerId='" + providerId + '\'' +
                ", claims=" + claims +
                ", registered=" + (registry != null) +
                ", excluded=" + (exclusion != null) +
                '}';
    }
}
