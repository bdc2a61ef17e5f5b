package com.providersentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Registry entity type, decoded from the registry's entity type code.
 *
 * @since 1.0.0
 */
public enum EntityType {

    INDIVIDUAL("individual"),
    ORGANIZATION("organization"),
    UNKNOWN("unknown");

    private final String id;

    EntityType(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    /**
     * Decode a registry entity type code ({@code 1} = individual,
     * {@code 2} = organization).
     *
     * @param code raw code, may be {@code null}
     * @return matching type, {@link #UNKNOWN} for anything else
     */
    public static EntityType fromCode(String code) {
        if (code == null) {
            return UNKNOWN;
        }
        return switch (code.trim()) {
            case "1" -> INDIVIDUAL;
            case "2" -> ORGANIZATION;
            default -> UNKNOWN;
        };
    }
}
