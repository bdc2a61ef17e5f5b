package com.providersentinel.core.resolve;

import com.providersentinel.core.model.Claim;
import com.providersentinel.core.model.ExclusionRecord;
import com.providersentinel.core.model.ProviderView;
import com.providersentinel.core.model.RegistryEntity;

import java.time.YearMonth;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;

/**
 * Immutable output of entity resolution, shared read-only by every detector.
 *
 * <p>
 * Besides the provider views, it keeps the inputs some detectors need at a
 * finer grain: claims with a valid billing identifier, registry entities with
 * a valid identifier, and the authoritative exclusion record per identifier.
 * </p>
 *
 * @since 1.0.0
 */
public final class ResolvedDataset {

    private final SortedMap<String, ProviderView> views;
    private final List<Claim> claims;
    private final Map<String, RegistryEntity> registry;
    private final Map<String, ExclusionRecord> exclusions;
    private final YearMonth latestClaimMonth;
    private final long providersScanned;

    ResolvedDataset(SortedMap<String, ProviderView> views,
            List<Claim> claims,
            Map<String, RegistryEntity> registry,
            Map<String, ExclusionRecord> exclusions,
            YearMonth latestClaimMonth,
            long providersScanned) {
        this.views = Collections.unmodifiableSortedMap(Objects.requireNonNull(views, "views must not be null"));
        this.claims = Collections.unmodifiableList(Objects.requireNonNull(claims, "claims must not be null"));
        this.registry = Collections.unmodifiableMap(Objects.requireNonNull(registry, "registry must not be null"));
        this.exclusions = Collections.unmodifiableMap(
                Objects.requireNonNull(exclusions, "exclusions must not be null"));
        this.latestClaimMonth = latestClaimMonth;
        this.providersScanned = providersScanned;
    }

    /**
     * @return views keyed by identifier, in identifier order
     */
    public SortedMap<String, ProviderView> getViews() {
        return views;
    }

    public Collection<ProviderView> getProviderViews() {
        return views.values();
    }

    public Optional<ProviderView> getView(String providerId) {
        return Optional.ofNullable(views.get(providerId));
    }

    /**
     * @return claims whose billing identifier is valid, in source order
     */
    public List<Claim> getClaims() {
        return claims;
    }

    public Collection<RegistryEntity> getRegistryEntities() {
        return registry.values();
    }

    public Optional<RegistryEntity> getRegistryEntity(String providerId) {
        return Optional.ofNullable(registry.get(providerId));
    }

    /**
     * @return authoritative exclusion record per valid identifier
     */
    public Map<String, ExclusionRecord> getExclusions() {
        return exclusions;
    }

    public Optional<ExclusionRecord> getExclusion(String providerId) {
        return Optional.ofNullable(exclusions.get(providerId));
    }

    /**
     * @return the latest service month seen in any valid claim, empty when
     *         there are no claims
     */
    public Optional<YearMonth> getLatestClaimMonth() {
        return Optional.ofNullable(latestClaimMonth);
    }

    /** Distinct valid billing identifiers in the claims. */
    public long getProvidersScanned() {
        return providersScanned;
    }

    @Override
    public String toString() {
        return "ResolvedDataset{" +
                "views=" + views.size() +
                ", claims=" + claims.size() +
                ", registry=" + registry.size() +
                ", exclusions=" + exclusions.size() +
                ", latestClaimMonth=" + latestClaimMonth +
                '}';
    }
}
