package com.providersentinel.core.resolve;

/**
 * Provider identifier validity rule.
 *
 * <p>
 * An identifier is valid iff it is exactly {@value #LENGTH} characters, all
 * decimal digits, and not the all-zero sentinel. Invalid identifiers are
 * filtered out, never raised as errors.
 * </p>
 *
 * @since 1.0.0
 */
public final class ProviderIds {

    public static final int LENGTH = 10;

    static final String ALL_ZERO = "0000000000";

    private ProviderIds() {
        // utility class
    }

    /**
     * @param id candidate identifier, may be {@code null}
     * @return {@code true} if the identifier is valid
     */
    public static boolean isValid(String id) {
        if (id == null || id.length() != LENGTH || ALL_ZERO.equals(id)) {
            return false;
        }
        for (int i = 0; i < LENGTH; i++) {
            char c = id.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}
