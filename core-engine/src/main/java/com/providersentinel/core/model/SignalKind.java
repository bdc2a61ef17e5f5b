package com.providersentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The six fraud patterns the engine detects.
 *
 * <p>
 * Declaration order is the canonical order used for counts, engine results
 * and report evidence lists.
 * </p>
 *
 * @since 1.0.0
 */
public enum SignalKind {

    EXCLUDED_PROVIDER("excluded_provider"),
    BILLING_OUTLIER("billing_outlier"),
    RAPID_ESCALATION("rapid_escalation"),
    WORKFORCE_IMPOSSIBILITY("workforce_impossibility"),
    SHARED_OFFICIAL("shared_official"),
    GEOGRAPHIC_IMPLAUSIBILITY("geographic_implausibility");

    private final String id;

    SignalKind(String id) {
        this.id = id;
    }

    /**
     * @return the snake_case identifier used in configuration and reports
     */
    @JsonValue
    public String getId() {
        return id;
    }

    /**
     * Resolve a kind from its configuration identifier (case-insensitive).
     *
     * @param id identifier such as {@code billing_outlier}
     * @return the matching kind
     * @throws IllegalArgumentException if no kind matches
     */
    public static SignalKind fromId(String id) {
        if (id != null) {
            String normalized = id.trim().toLowerCase(Locale.ROOT);
            for (SignalKind kind : values()) {
                if (kind.id.equals(normalized)) {
                    return kind;
                }
            }
        }
        throw new IllegalArgumentException("Unknown signal type: '" + id + "'");
    }
}
