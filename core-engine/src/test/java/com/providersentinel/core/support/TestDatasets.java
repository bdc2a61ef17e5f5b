package com.providersentinel.core.support;

import com.providersentinel.core.model.Claim;
import com.providersentinel.core.model.EntityType;
import com.providersentinel.core.model.ExclusionRecord;
import com.providersentinel.core.model.RegistryEntity;
import com.providersentinel.core.resolve.EntityResolver;
import com.providersentinel.core.resolve.ResolvedDataset;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;

/**
 * Fluent builder for small in-memory datasets used across the unit tests.
 */
public final class TestDatasets {

    private final List<Claim> claims = new ArrayList<>();
    private final List<ExclusionRecord> exclusions = new ArrayList<>();
    private final List<RegistryEntity> registry = new ArrayList<>();

    public static TestDatasets dataset() {
        return new TestDatasets();
    }

    /** One claim with no procedure code and a unique beneficiary. */
    public TestDatasets claim(String billingId, String month, double paid) {
        claims.add(Claim.builder()
                .billingProviderId(billingId)
                .serviceMonth(YearMonth.parse(month))
                .paidAmount(paid)
                .beneficiaryId("B" + claims.size())
                .build());
        return this;
    }

    public TestDatasets claim(Claim claim) {
        claims.add(claim);
        return this;
    }

    /**
     * {@code count} claims of {@code code} in one month, cycling through
     * {@code beneficiaries} distinct beneficiaries.
     */
    public TestDatasets claims(String billingId, String month, int count, double paidEach,
            String code, int beneficiaries) {
        for (int i = 0; i < count; i++) {
            claims.add(Claim.builder()
                    .billingProviderId(billingId)
                    .serviceMonth(YearMonth.parse(month))
                    .paidAmount(paidEach)
                    .procedureCode(code)
                    .beneficiaryId(billingId + "-B" + (i % beneficiaries))
                    .build());
        }
        return this;
    }

    public TestDatasets registry(RegistryEntity entity) {
        registry.add(entity);
        return this;
    }

    public TestDatasets exclusion(ExclusionRecord record) {
        exclusions.add(record);
        return this;
    }

    public TestDatasets individual(String id, String taxonomy, String state) {
        return registry(RegistryEntity.builder()
                .providerId(id)
                .entityType(EntityType.INDIVIDUAL)
                .name("Provider " + id)
                .taxonomyCode(taxonomy)
                .state(state)
                .build());
    }

    public TestDatasets organization(String id, String officialLast, String officialFirst) {
        return registry(RegistryEntity.builder()
                .providerId(id)
                .entityType(EntityType.ORGANIZATION)
                .name("Org " + id)
                .state("NY")
                .officialLastName(officialLast)
                .officialFirstName(officialFirst)
                .build());
    }

    public TestDatasets excluded(String id, String exclusionDate, String reinstatementDate) {
        return exclusion(ExclusionRecord.builder()
                .providerId(id)
                .exclusionDate(exclusionDate != null ? LocalDate.parse(exclusionDate) : null)
                .reinstatementDate(reinstatementDate != null ? LocalDate.parse(reinstatementDate) : null)
                .exclusionType("1128a1")
                .name("EXCLUDED " + id)
                .state("CA")
                .build());
    }

    public List<Claim> getClaims() {
        return claims;
    }

    public ResolvedDataset resolve() {
        return EntityResolver.resolve(claims, exclusions, registry);
    }

    /** Ten-digit identifier built from a small number. */
    public static String npi(int n) {
        return String.format("%010d", 1_000_000_000L + n);
    }
}
