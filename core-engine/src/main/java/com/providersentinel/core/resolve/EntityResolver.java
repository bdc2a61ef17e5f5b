package com.providersentinel.core.resolve;

import com.providersentinel.core.ingest.RawDatasets;
import com.providersentinel.core.model.Claim;
import com.providersentinel.core.model.ClaimAggregate;
import com.providersentinel.core.model.ExclusionRecord;
import com.providersentinel.core.model.ProviderView;
import com.providersentinel.core.model.RegistryEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Builds the canonical provider-centric view from the loaded sources.
 *
 * <ul>
 * <li>claims are aggregated per valid billing identifier;</li>
 * <li>the first registry entry per valid identifier wins;</li>
 * <li>of several exclusion records for one identifier, the one with the
 * latest exclusion date is authoritative (the first in source order on
 * ties; an undated record only wins when no dated one exists);</li>
 * <li>a view exists for every valid identifier with claims or a registry
 * entry, and for no other.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class EntityResolver {

    private static final Logger LOG = LoggerFactory.getLogger(EntityResolver.class);

    private EntityResolver() {
        // utility class
    }

    public static ResolvedDataset resolve(RawDatasets datasets) {
        Objects.requireNonNull(datasets, "datasets must not be null");
        return resolve(datasets.getClaims().getRecords(),
                datasets.getExclusions().getRecords(),
                datasets.getRegistry().getRecords());
    }

    /**
     * @param claims     loaded claims, in source order
     * @param exclusions loaded exclusion records, in source order
     * @param registry   loaded registry entities, in source order
     * @return the frozen resolved dataset
     */
    public static ResolvedDataset resolve(List<Claim> claims,
            List<ExclusionRecord> exclusions,
            List<RegistryEntity> registry) {
        Objects.requireNonNull(claims, "claims must not be null");
        Objects.requireNonNull(exclusions, "exclusions must not be null");
        Objects.requireNonNull(registry, "registry must not be null");

        List<Claim> validClaims = new ArrayList<>(claims.size());
        Map<String, AggregateBuilder> builders = new HashMap<>();
        YearMonth latest = null;
        for (Claim claim : claims) {
            String id = claim.getBillingProviderId();
            if (!ProviderIds.isValid(id)) {
                continue;
            }
            validClaims.add(claim);
            builders.computeIfAbsent(id, k -> new AggregateBuilder()).add(claim);
            if (latest == null || claim.getServiceMonth().isAfter(latest)) {
                latest = claim.getServiceMonth();
            }
        }

        Map<String, RegistryEntity> registryIndex = new LinkedHashMap<>();
        for (RegistryEntity entity : registry) {
            if (ProviderIds.isValid(entity.getProviderId())) {
                registryIndex.putIfAbsent(entity.getProviderId(), entity);
            }
        }

        Map<String, ExclusionRecord> exclusionIndex = indexExclusions(exclusions);

        Set<String> ids = new TreeSet<>(builders.keySet());
        ids.addAll(registryIndex.keySet());
        TreeMap<String, ProviderView> views = new TreeMap<>();
        for (String id : ids) {
            AggregateBuilder builder = builders.get(id);
            views.put(id, new ProviderView(id,
                    builder != null ? builder.build() : ClaimAggregate.EMPTY,
                    registryIndex.get(id),
                    exclusionIndex.get(id)));
        }

        LOG.info("Resolved {} provider view(s) from {} valid claim(s) ({} dropped), "
                + "{} registry entit(ies), {} excluded identifier(s)",
                views.size(), validClaims.size(), claims.size() - validClaims.size(),
                registryIndex.size(), exclusionIndex.size());

        return new ResolvedDataset(views, validClaims, registryIndex, exclusionIndex,
                latest, builders.size());
    }

    static Map<String, ExclusionRecord> indexExclusions(List<ExclusionRecord> exclusions) {
        Map<String, ExclusionRecord> index = new HashMap<>();
        for (ExclusionRecord record : exclusions) {
            String id = record.getProviderId().orElse(null);
            if (!ProviderIds.isValid(id)) {
                continue;
            }
            ExclusionRecord current = index.get(id);
            if (current == null || supersedes(record, current)) {
                index.put(id, record);
            }
        }
        return index;
    }

    private static boolean supersedes(ExclusionRecord candidate, ExclusionRecord current) {
        LocalDate candidateDate = candidate.getExclusionDate().orElse(null);
        if (candidateDate == null) {
            return false;
        }
        LocalDate currentDate = current.getExclusionDate().orElse(null);
        return currentDate == null || candidateDate.isAfter(currentDate);
    }

    // ---------------------------------------------------------------
    // Per-provider accumulation
    // ---------------------------------------------------------------

    private static final class AggregateBuilder {

        private final Map<YearMonth, Double> paid = new HashMap<>();
        private final Map<YearMonth, Integer> counts = new HashMap<>();
        private final Map<YearMonth, Set<String>> beneficiaries = new HashMap<>();
        private final Set<String> allBeneficiaries = new HashSet<>();

        void add(Claim claim) {
            YearMonth month = claim.getServiceMonth();
            paid.merge(month, claim.getPaidAmount(), Double::sum);
            counts.merge(month, 1, Integer::sum);
            Set<String> seen = beneficiaries.computeIfAbsent(month, k -> new HashSet<>());
            if (claim.getBeneficiaryId() != null) {
                seen.add(claim.getBeneficiaryId());
                allBeneficiaries.add(claim.getBeneficiaryId());
            }
        }

        ClaimAggregate build() {
            Map<YearMonth, Integer> distinct = new HashMap<>();
            beneficiaries.forEach((month, seen) -> distinct.put(month, seen.size()));
            return new ClaimAggregate(paid, counts, distinct, allBeneficiaries.size());
        }
    }
}
