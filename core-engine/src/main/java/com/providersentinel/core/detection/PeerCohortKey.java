package com.providersentinel.core.detection;

import java.util.Comparator;
import java.util.Objects;

/**
 * Composite (taxonomy code, state) key of a peer cohort.
 *
 * @since 1.0.0
 */
public final class PeerCohortKey implements Comparable<PeerCohortKey> {

    private static final Comparator<PeerCohortKey> ORDER = Comparator
            .comparing(PeerCohortKey::getTaxonomyCode)
            .thenComparing(PeerCohortKey::getState);

    private final String taxonomyCode;
    private final String state;

    public PeerCohortKey(String taxonomyCode, String state) {
        this.taxonomyCode = Objects.requireNonNull(taxonomyCode, "taxonomyCode must not be null");
        this.state = Objects.requireNonNull(state, "state must not be null");
    }

    public String getTaxonomyCode() {
        return taxonomyCode;
    }

    public String getState() {
        return state;
    }

    @Override
    public int compareTo(PeerCohortKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PeerCohortKey that))
            return false;
        return taxonomyCode.equals(that.taxonomyCode) && state.equals(that.state);
    }

    @Override
    public int hashCode() {
        return Objects.hash(taxonomyCode, state);
    }

    @Override
    public String toString() {
        return taxonomyCode + "/" + state;
    }
}
