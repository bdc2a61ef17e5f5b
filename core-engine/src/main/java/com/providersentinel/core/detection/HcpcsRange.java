package com.providersentinel.core.detection;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Inclusive range of HCPCS Level II codes sharing one letter prefix, e.g.
 * {@code G0151-G0162}. A code matches when its prefix letter is equal and
 * its four-digit numeric part lies within the range.
 *
 * @since 1.0.0
 */
public final class HcpcsRange {

    /** Home-health service code ranges. */
    public static final List<HcpcsRange> HOME_HEALTH = List.of(
            new HcpcsRange('G', 151, 162),
            new HcpcsRange('G', 299, 300),
            new HcpcsRange('S', 9122, 9124),
            new HcpcsRange('T', 1019, 1022));

    private static final int CODE_LENGTH = 5;

    private final char prefix;
    private final int low;
    private final int high;

    public HcpcsRange(char prefix, int low, int high) {
        if (low > high) {
            throw new IllegalArgumentException("low must be <= high, got " + low + " > " + high);
        }
        this.prefix = Character.toUpperCase(prefix);
        this.low = low;
        this.high = high;
    }

    /**
     * @param code HCPCS code, may be {@code null}
     * @return {@code true} if the code lies within this range
     */
    public boolean contains(String code) {
        if (code == null) {
            return false;
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        if (normalized.length() != CODE_LENGTH || normalized.charAt(0) != prefix) {
            return false;
        }
        int number = 0;
        for (int i = 1; i < CODE_LENGTH; i++) {
            char c = normalized.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
            number = number * 10 + (c - '0');
        }
        return number >= low && number <= high;
    }

    /**
     * @param code HCPCS code, may be {@code null}
     * @return {@code true} if the code is a home-health service code
     */
    public static boolean isHomeHealth(String code) {
        for (HcpcsRange range : HOME_HEALTH) {
            if (range.contains(code)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof HcpcsRange that))
            return false;
        return prefix == that.prefix && low == that.low && high == that.high;
    }

    @Override
    public int hashCode() {
        return Objects.hash(prefix, low, high);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%c%04d-%c%04d", prefix, low, prefix, high);
    }
}
