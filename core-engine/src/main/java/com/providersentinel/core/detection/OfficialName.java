package com.providersentinel.core.detection;

import java.util.Comparator;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Exact composite key of an authorized official: (last name, first name),
 * each trimmed and upper-cased.
 *
 * @since 1.0.0
 */
public final class OfficialName implements Comparable<OfficialName> {

    private static final Comparator<OfficialName> ORDER = Comparator
            .comparing(OfficialName::getLastName)
            .thenComparing(OfficialName::getFirstName);

    private final String lastName;
    private final String firstName;

    private OfficialName(String lastName, String firstName) {
        this.lastName = lastName;
        this.firstName = firstName;
    }

    /**
     * @param lastName  raw last name, may be {@code null}
     * @param firstName raw first name, may be {@code null}
     * @return the normalized key, empty when either part is blank
     */
    public static Optional<OfficialName> of(String lastName, String firstName) {
        String last = normalize(lastName);
        String first = normalize(firstName);
        if (last == null || first == null) {
            return Optional.empty();
        }
        return Optional.of(new OfficialName(last, first));
    }

    private static String normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return raw.trim().toUpperCase(Locale.ROOT);
    }

    public String getLastName() {
        return lastName;
    }

    public String getFirstName() {
        return firstName;
    }

    /** "LAST, FIRST". */
    public String getDisplayName() {
        return lastName + ", " + firstName;
    }

    @Override
    public int compareTo(OfficialName other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof OfficialName that))
            return false;
        return lastName.equals(that.lastName) && firstName.equals(that.firstName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lastName, firstName);
    }

    @Override
    public String toString() {
        return getDisplayName();
    }
}
