package com.providersentinel.core.report;

import com.providersentinel.core.model.SignalHit;
import com.providersentinel.core.model.SignalKind;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Static mapping from signal kind to its False Claims Act relevance.
 *
 * <p>
 * Next-step templates may reference {@code {npi}}, {@code {state}} and any
 * evidence key of the hit (e.g. {@code {exclusion_date}}); placeholders with
 * no value render as {@code unknown}. Collections render comma-separated.
 * </p>
 *
 * @since 1.0.0
 */
public final class FcaCatalog {

    private static final String STATUTE = "31 U.S.C. § 3729(a)(1)";
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([a-z_]+)}");

    private static final Map<SignalKind, Entry> ENTRIES = new EnumMap<>(SignalKind.class);

    static {
        register(SignalKind.EXCLUDED_PROVIDER, "(A)",
                "False claims submitted by an excluded provider: the provider was barred from federal "
                        + "healthcare programs but continued billing",
                "Verify the exclusion status of NPI {npi} in the LEIE database",
                "Request claims records for NPI {npi} from {exclusion_date} forward",
                "Refer NPI {npi} to the {state} Medicaid Fraud Control Unit");
        register(SignalKind.BILLING_OUTLIER, "(A)",
                "Potential overbilling: billing volume significantly exceeds peer group norms",
                "Audit claims for NPI {npi} against peer providers in {taxonomy_code}/{state}",
                "Request medical records supporting the high-volume claims of NPI {npi}",
                "Interview a sample of beneficiaries to verify services were rendered");
        register(SignalKind.RAPID_ESCALATION, "(A)",
                "Potential bust-out scheme: a newly enrolled entity showed rapid, unsustainable billing "
                        + "escalation",
                "Investigate ownership and management of NPI {npi} (enumerated {enumeration_date})",
                "Review business formation documents and enrollment applications for NPI {npi}",
                "Analyze referral patterns around {peak_month} for kickback arrangements");
        register(SignalKind.WORKFORCE_IMPOSSIBILITY, "(B)",
                "False records: claimed service volume is physically impossible given workforce constraints",
                "Request employment records and staffing levels of NPI {npi} for {peak_month}",
                "Verify that {implied_claims_per_hour} claims per hour is humanly possible",
                "Audit time-of-service documentation for a sample of claims from NPI {npi}");
        register(SignalKind.SHARED_OFFICIAL, "(C)",
                "Conspiracy: coordinated billing through multiple entities controlled by one individual",
                "Investigate business relationships among the {member_count} entities controlled by "
                        + "{authorized_official}",
                "Review corporate formation documents of NPI {npi} for common ownership",
                "Examine referral and billing patterns between the controlled entities");
        register(SignalKind.GEOGRAPHIC_IMPLAUSIBILITY, "(G)",
                "Reverse false claims: repeated billing on the same patients suggests phantom services",
                "Audit home health claims of NPI {npi} in {state} for {flagged_month}",
                "Request documentation for HCPCS codes {hcpcs_codes}",
                "Verify beneficiary addresses and their ability to receive home services");
    }

    private FcaCatalog() {
        // utility class
    }

    private static void register(SignalKind kind, String subsection, String claimType, String... steps) {
        ENTRIES.put(kind, new Entry(STATUTE + subsection, claimType, List.of(steps)));
    }

    /**
     * @param kind signal kind
     * @return statute citation, e.g. {@code 31 U.S.C. § 3729(a)(1)(A)}
     */
    public static String statuteFor(SignalKind kind) {
        return entry(kind).statute;
    }

    /**
     * Render the relevance of one hit.
     *
     * @param hit   the signal hit
     * @param state provider state used by some templates, may be {@code null}
     * @return relevance with templated next steps
     */
    public static FcaRelevance relevanceFor(SignalHit hit, String state) {
        Objects.requireNonNull(hit, "hit must not be null");
        Entry entry = entry(hit.getKind());

        Map<String, Object> values = new HashMap<>(hit.getEvidence());
        values.put("npi", hit.getProviderId());
        values.putIfAbsent("state", state);

        List<String> steps = new ArrayList<>(entry.steps.size());
        for (String template : entry.steps) {
            steps.add(render(template, values));
        }
        return new FcaRelevance(entry.claimType, entry.statute, steps);
    }

    static String render(String template, Map<String, Object> values) {
        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            m.appendReplacement(out, Matcher.quoteReplacement(format(values.get(m.group(1)))));
        }
        m.appendTail(out);
        return out.toString();
    }

    private static String format(Object value) {
        if (value == null) {
            return "unknown";
        }
        if (value instanceof Double d) {
            return String.format(Locale.ROOT, "%.1f", d);
        }
        if (value instanceof Collection<?> c) {
            List<String> parts = new ArrayList<>(c.size());
            c.forEach(v -> parts.add(String.valueOf(v)));
            return String.join(", ", parts);
        }
        return String.valueOf(value);
    }

    private static Entry entry(SignalKind kind) {
        Entry entry = ENTRIES.get(Objects.requireNonNull(kind, "kind must not be null"));
        if (entry == null) {
            throw new IllegalStateException("No FCA mapping for signal kind '" + kind.getId() + "'");
        }
        return entry;
    }

    private static final class Entry {

        private final String statute;
        private final String claimType;
        private final List<String> steps;

        Entry(String statute, String claimType, List<String> steps) {
            this.statute = statute;
            this.claimType = claimType;
            this.steps = steps;
        }
    }
}
