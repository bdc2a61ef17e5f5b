package com.providersentinel.core.report;

import java.util.List;
import java.util.Objects;

/**
 * False Claims Act framing of a signal: the statute subsection it maps to,
 * the kind of false claim it suggests, and concrete investigative steps.
 *
 * @since 1.0.0
 */
public final class FcaRelevance {

    private final String claimType;
    private final String statuteReference;
    private final List<String> suggestedNextSteps;

    public FcaRelevance(String claimType, String statuteReference, List<String> suggestedNextSteps) {
        this.claimType = Objects.requireNonNull(claimType, "claimType must not be null");
        this.statuteReference = Objects.requireNonNull(statuteReference, "statuteReference must not be null");
        this.suggestedNextSteps = List.copyOf(suggestedNextSteps);
    }

    public String getClaimType() {
        return claimType;
    }

    public String getStatuteReference() {
        return statuteReference;
    }

    public List<String> getSuggestedNextSteps() {
        return suggestedNextSteps;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FcaRelevance that))
            return false;
        return claimType.equals(that.claimType)
                && statuteReference.equals(that.statuteReference)
                && suggestedNextSteps.equals(that.suggestedNextSteps);
    }

    @Override
    public int hashCode() {
        return Objects.hash(claimType, statuteReference, suggestedNextSteps);
    }

    @Override
    public String toString() {
        return "FcaRelevance{" +
                "statuteReference='" + statuteReference + '\'' +
                ", steps=" + suggestedNextSteps.size() +
                '}';
    }
}
