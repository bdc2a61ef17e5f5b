package com.providersentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity attached to a signal hit. Declared from most to least severe.
 *
 * @since 1.0.0
 */
public enum Severity {

    CRITICAL,
    HIGH,
    MEDIUM;

    @JsonValue
    public String getId() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @param other severity to compare with
     * @return the more severe of {@code this} and {@code other}
     */
    public Severity max(Severity other) {
        return other != null && other.ordinal() < ordinal() ? other : this;
    }
}
