package com.providersentinel.core.ingest;

import com.providersentinel.core.model.ExclusionRecord;

import java.nio.file.Path;
import java.util.Map;

/**
 * Loads the exclusion list in its published column layout
 * ({@code LASTNAME, FIRSTNAME, BUSNAME, NPI, STATE, EXCLTYPE, EXCLDATE,
 * REINDATE}; other columns are ignored).
 *
 * <p>
 * Many rows carry no identifier, or the all-zero identifier; they are kept
 * here and dropped by the resolver's validity rule. Dates go through
 * {@link SourceDates#parseCompactDate(String)}, so the all-zero sentinel
 * becomes an absent date.
 * </p>
 *
 * @since 1.0.0
 */
public final class ExclusionListLoader {

    public static final String LAST_NAME = "LASTNAME";
    public static final String FIRST_NAME = "FIRSTNAME";
    public static final String BUSINESS_NAME = "BUSNAME";
    public static final String NPI = "NPI";
    public static final String STATE = "STATE";
    public static final String EXCLUSION_TYPE = "EXCLTYPE";
    public static final String EXCLUSION_DATE = "EXCLDATE";
    public static final String REINSTATEMENT_DATE = "REINDATE";

    private ExclusionListLoader() {
        // utility class
    }

    /**
     * @param file exclusion list CSV
     * @return loaded exclusion records
     * @throws DatasetLoadException if the file is missing or unreadable
     */
    public static LoadResult<ExclusionRecord> load(Path file) {
        return CsvSource.read(file, ExclusionListLoader::toRecord);
    }

    static ExclusionRecord toRecord(Map<String, String> row) {
        return ExclusionRecord.builder()
                .providerId(CsvSource.optional(row, NPI))
                .exclusionDate(SourceDates.parseCompactDate(row.get(EXCLUSION_DATE)))
                .reinstatementDate(SourceDates.parseCompactDate(row.get(REINSTATEMENT_DATE)))
                .exclusionType(CsvSource.optional(row, EXCLUSION_TYPE))
                .name(displayName(row))
                .state(CsvSource.optional(row, STATE))
                .build();
    }

    private static String displayName(Map<String, String> row) {
        String business = CsvSource.optional(row, BUSINESS_NAME);
        if (business != null) {
            return business;
        }
        String last = CsvSource.optional(row, LAST_NAME);
        String first = CsvSource.optional(row, FIRST_NAME);
        if (last == null) {
            return first;
        }
        return first == null ? last : last + ", " + first;
    }
}
