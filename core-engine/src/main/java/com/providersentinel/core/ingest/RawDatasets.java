package com.providersentinel.core.ingest;

import com.providersentinel.core.model.Claim;
import com.providersentinel.core.model.ExclusionRecord;
import com.providersentinel.core.model.RegistryEntity;

import java.util.Objects;

/**
 * The three loaded sources, before entity resolution.
 *
 * @since 1.0.0
 */
public final class RawDatasets {

    private final LoadResult<Claim> claims;
    private final LoadResult<ExclusionRecord> exclusions;
    private final LoadResult<RegistryEntity> registry;

    public RawDatasets(LoadResult<Claim> claims,
            LoadResult<ExclusionRecord> exclusions,
            LoadResult<RegistryEntity> registry) {
        this.claims = Objects.requireNonNull(claims, "claims must not be null");
        this.exclusions = Objects.requireNonNull(exclusions, "exclusions must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    public LoadResult<Claim> getClaims() {
        return claims;
    }

    public LoadResult<ExclusionRecord> getExclusions() {
        return exclusions;
    }

    public LoadResult<RegistryEntity> getRegistry() {
        return registry;
    }

    /** Rows skipped across all three sources. */
    public long getTotalRowsSkipped() {
        return claims.getRowsSkipped() + exclusions.getRowsSkipped() + registry.getRowsSkipped();
    }
}
