package com.providersentinel.core.ingest;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Date normalization shared by every loader.
 *
 * <p>
 * The exclusion list encodes "no date" as an all-zero string
 * ({@code 00000000}). Such values, and blank values, normalise to
 * {@code null} here and nowhere else, so downstream code (the exclusion
 * window check in particular) only ever sees real dates or absence.
 * </p>
 *
 * @since 1.0.0
 */
public final class SourceDates {

    private static final DateTimeFormatter COMPACT = DateTimeFormatter.BASIC_ISO_DATE;
    private static final DateTimeFormatter US_SLASHED = DateTimeFormatter.ofPattern("MM/dd/uuuu");
    private static final DateTimeFormatter COMPACT_MONTH = DateTimeFormatter.ofPattern("uuuuMM");

    private SourceDates() {
        // utility class
    }

    /**
     * @param raw raw field value
     * @return {@code true} if the value is blank or consists only of zeros
     *         (date separators ignored)
     */
    public static boolean isAbsent(String raw) {
        if (raw == null || raw.isBlank()) {
            return true;
        }
        for (char c : raw.trim().toCharArray()) {
            if (c != '0' && c != '-' && c != '/') {
                return false;
            }
        }
        return true;
    }

    /**
     * Parse an exclusion-list date ({@code yyyyMMdd}; ISO {@code yyyy-MM-dd}
     * is accepted too).
     *
     * @param raw raw value
     * @return the date, or {@code null} for the all-zero sentinel or a blank
     *         value
     * @throws DateTimeParseException if the value is neither absent nor a
     *                                valid date
     */
    public static LocalDate parseCompactDate(String raw) {
        if (isAbsent(raw)) {
            return null;
        }
        String value = raw.trim();
        return value.indexOf('-') >= 0
                ? LocalDate.parse(value)
                : LocalDate.parse(value, COMPACT);
    }

    /**
     * Parse a registry date ({@code MM/dd/yyyy}, ISO or compact).
     *
     * @param raw raw value
     * @return the date, or {@code null} when absent
     * @throws DateTimeParseException if the value cannot be parsed
     */
    public static LocalDate parseRegistryDate(String raw) {
        if (isAbsent(raw)) {
            return null;
        }
        String value = raw.trim();
        if (value.indexOf('/') >= 0) {
            return LocalDate.parse(value, US_SLASHED);
        }
        return parseCompactDate(value);
    }

    /**
     * Parse a claim service month. Accepts {@code yyyy-MM},
     * {@code yyyy-MM-dd} (optionally followed by a time part),
     * {@code yyyyMM} and {@code yyyyMMdd}.
     *
     * @param raw raw value
     * @return the service month
     * @throws DateTimeParseException if the value is absent or malformed
     */
    public static YearMonth parseServiceMonth(String raw) {
        if (isAbsent(raw)) {
            throw new DateTimeParseException("Service month is missing", String.valueOf(raw), 0);
        }
        String value = raw.trim();
        if (value.indexOf('-') >= 0) {
            return value.length() == 7
                    ? YearMonth.parse(value)
                    : YearMonth.from(LocalDate.parse(value.substring(0, Math.min(10, value.length()))));
        }
        return switch (value.length()) {
            case 6 -> YearMonth.parse(value, COMPACT_MONTH);
            case 8 -> YearMonth.from(LocalDate.parse(value, COMPACT));
            default -> throw new DateTimeParseException("Unrecognised service month", value, 0);
        };
    }
}
