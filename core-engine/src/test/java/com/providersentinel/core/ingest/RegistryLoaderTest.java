package com.providersentinel.core.ingest;

import com.providersentinel.core.model.EntityType;
import com.providersentinel.core.model.RegistryEntity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RegistryLoader}.
 */
class RegistryLoaderTest {

    @Test
    @DisplayName("Should map an organization row with its authorized official")
    void shouldMapOrganization() {
        Map<String, String> row = new HashMap<>();
        row.put(RegistryLoader.NPI, "1234567893");
        row.put(RegistryLoader.ENTITY_TYPE_CODE, "2");
        row.put(RegistryLoader.ORGANIZATION_NAME, "Sunrise Home Health");
        row.put(RegistryLoader.STATE, "MN");
        row.put(RegistryLoader.TAXONOMY_CODE, "251E00000X");
        row.put(RegistryLoader.ENUMERATION_DATE, "03/15/2022");
        row.put(RegistryLoader.OFFICIAL_LAST_NAME, "Smith");
        row.put(RegistryLoader.OFFICIAL_FIRST_NAME, "Jane");

        RegistryEntity entity = RegistryLoader.toEntity(row);

        assertThat(entity.getEntityType()).isEqualTo(EntityType.ORGANIZATION);
        assertThat(entity.getName()).isEqualTo("Sunrise Home Health");
        assertThat(entity.getState()).contains("MN");
        assertThat(entity.getTaxonomyCode()).contains("251E00000X");
        assertThat(entity.getEnumerationDate()).contains(LocalDate.of(2022, 3, 15));
        assertThat(entity.getOfficialLastName()).contains("Smith");
    }

    @Test
    @DisplayName("Should build an individual's name as last, first")
    void shouldMapIndividual() {
        Map<String, String> row = new HashMap<>();
        row.put(RegistryLoader.NPI, "1234567893");
        row.put(RegistryLoader.ENTITY_TYPE_CODE, "1");
        row.put(RegistryLoader.ORGANIZATION_NAME, "");
        row.put(RegistryLoader.LAST_NAME, "Doe");
        row.put(RegistryLoader.FIRST_NAME, "John");

        RegistryEntity entity = RegistryLoader.toEntity(row);

        assertThat(entity.getEntityType()).isEqualTo(EntityType.INDIVIDUAL);
        assertThat(entity.getName()).isEqualTo("Doe, John");
        assertThat(entity.getEnumerationDate()).isEmpty();
    }

    @Test
    @DisplayName("Should reject a row without an identifier")
    void shouldRejectMissingNpi() {
        Map<String, String> row = new HashMap<>();
        row.put(RegistryLoader.NPI, " ");

        assertThatThrownBy(() -> RegistryLoader.toEntity(row))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(RegistryLoader.NPI);
    }
}
