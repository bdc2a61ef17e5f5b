package com.providersentinel.core.ingest;

import com.providersentinel.core.model.EntityType;
import com.providersentinel.core.model.RegistryEntity;

import java.nio.file.Path;
import java.util.Map;

/**
 * Loads the provider registry in its published column layout. Only the
 * columns named below are read; the full file has several hundred.
 *
 * @since 1.0.0
 */
public final class RegistryLoader {

    public static final String NPI = "NPI";
    public static final String ENTITY_TYPE_CODE = "Entity Type Code";
    public static final String ORGANIZATION_NAME = "Provider Organization Name (Legal Business Name)";
    public static final String LAST_NAME = "Provider Last Name (Legal Name)";
    public static final String FIRST_NAME = "Provider First Name";
    public static final String STATE = "Provider Business Practice Location Address State Name";
    public static final String TAXONOMY_CODE = "Healthcare Provider Taxonomy Code_1";
    public static final String ENUMERATION_DATE = "Provider Enumeration Date";
    public static final String OFFICIAL_LAST_NAME = "Authorized Official Last Name";
    public static final String OFFICIAL_FIRST_NAME = "Authorized Official First Name";

    private RegistryLoader() {
        // utility class
    }

    /**
     * @param file registry CSV
     * @return loaded registry entities
     * @throws DatasetLoadException if the file is missing or unreadable
     */
    public static LoadResult<RegistryEntity> load(Path file) {
        return CsvSource.read(file, RegistryLoader::toEntity);
    }

    static RegistryEntity toEntity(Map<String, String> row) {
        return RegistryEntity.builder()
                .providerId(CsvSource.required(row, NPI))
                .entityType(EntityType.fromCode(CsvSource.optional(row, ENTITY_TYPE_CODE)))
                .name(displayName(row))
                .taxonomyCode(CsvSource.optional(row, TAXONOMY_CODE))
                .state(CsvSource.optional(row, STATE))
                .enumerationDate(SourceDates.parseRegistryDate(row.get(ENUMERATION_DATE)))
                .officialLastName(CsvSource.optional(row, OFFICIAL_LAST_NAME))
                .officialFirstName(CsvSource.optional(row, OFFICIAL_FIRST_NAME))
                .build();
    }

    // Organization legal name, else "Last, First".
    private static String displayName(Map<String, String> row) {
        String organization = CsvSource.optional(row, ORGANIZATION_NAME);
        if (organization != null) {
            return organization;
        }
        String last = CsvSource.optional(row, LAST_NAME);
        String first = CsvSource.optional(row, FIRST_NAME);
        if (last == null) {
            return first;
        }
        return first == null ? last : last + ", " + first;
    }
}
