package com.providersentinel.core.detection;

import com.providersentinel.core.model.RegistryEntity;
import com.providersentinel.core.model.Severity;
import com.providersentinel.core.model.SignalHit;
import com.providersentinel.core.model.SignalKind;
import com.providersentinel.core.model.SignalRule;
import com.providersentinel.core.resolve.ResolvedDataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Several organizations controlled by the same authorized official.
 *
 * <p>
 * Organizations are grouped by {@link OfficialName}; a group is flagged when
 * it has at least {@code minMembers} distinct identifiers and their combined
 * total paid strictly exceeds {@code minCombinedPaid}. Every member of a
 * flagged group receives its own hit carrying the shared group evidence. No
 * overpayment is estimated for this signal.
 * </p>
 *
 * @since 1.0.0
 */
public class SharedOfficialDetector implements SignalDetector {

    private static final Logger LOG = LoggerFactory.getLogger(SharedOfficialDetector.class);

    /** Combined total above which a group is {@link Severity#HIGH}. */
    static final double HIGH_SEVERITY_COMBINED_PAID = 5_000_000;

    private final String ruleName;
    private final int minMembers;
    private final double minCombinedPaid;

    /**
     * @param rule the signal rule configuration
     * @throws NullPointerException if {@code rule} or its name is {@code null}
     */
    public SharedOfficialDetector(SignalRule rule) {
        Objects.requireNonNull(rule, "SignalRule must not be null");
        this.ruleName = Objects.requireNonNull(rule.getName(), "Rule name must not be null");
        this.minMembers = rule.getMinMembers();
        this.minCombinedPaid = rule.getMinCombinedPaid();
    }

    @Override
    public List<SignalHit> detect(ResolvedDataset dataset) {
        Objects.requireNonNull(dataset, "dataset must not be null");

        Map<OfficialName, TreeSet<String>> groups = new TreeMap<>();
        for (RegistryEntity entity : dataset.getRegistryEntities()) {
            if (!entity.isOrganization()) {
                continue;
            }
            Optional<OfficialName> official = OfficialName.of(
                    entity.getOfficialLastName().orElse(null),
                    entity.getOfficialFirstName().orElse(null));
            official.ifPresent(name -> groups.computeIfAbsent(name, k -> new TreeSet<>())
                    .add(entity.getProviderId()));
        }

        List<SignalHit> hits = new ArrayList<>();
        int flaggedGroups = 0;
        for (Map.Entry<OfficialName, TreeSet<String>> group : groups.entrySet()) {
            TreeSet<String> members = group.getValue();
            if (members.size() < minMembers) {
                continue;
            }
            Map<String, Double> paidPerMember = new LinkedHashMap<>();
            double combined = 0;
            for (String id : members) {
                double paid = dataset.getView(id).map(v -> v.getTotalPaid()).orElse(0.0);
                paidPerMember.put(id, paid);
                combined += paid;
            }
            if (combined <= minCombinedPaid) {
                continue;
            }
            flaggedGroups++;
            Severity severity = combined > HIGH_SEVERITY_COMBINED_PAID ? Severity.HIGH : Severity.MEDIUM;
            LOG.debug("Rule [{}] fired: official={} members={} combined={}",
                    ruleName, group.getKey(), members.size(), combined);

            List<String> memberIds = List.copyOf(members);
            Map<String, Double> sharedPaid = Collections.unmodifiableMap(paidPerMember);
            for (String id : members) {
                hits.add(SignalHit.builder()
                        .providerId(id)
                        .kind(SignalKind.SHARED_OFFICIAL)
                        .severity(severity)
                        .evidence("authorized_official", group.getKey().getDisplayName())
                        .evidence("member_count", members.size())
                        .evidence("member_ids", memberIds)
                        .evidence("paid_per_member", sharedPaid)
                        .evidence("combined_total_paid", combined)
                        .build());
            }
        }
        hits.sort(Comparator.comparing(SignalHit::getProviderId));
        LOG.info("Rule [{}]: {} flagged official(s) controlling {} provider(s)",
                ruleName, flaggedGroups, hits.size());
        return hits;
    }

    @Override
    public SignalKind getKind() {
        return SignalKind.SHARED_OFFICIAL;
    }

    @Override
    public String getRuleName() {
        return ruleName;
    }
}
