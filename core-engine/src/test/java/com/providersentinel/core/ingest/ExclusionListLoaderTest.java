package com.providersentinel.core.ingest;

import com.providersentinel.core.model.ExclusionRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ExclusionListLoader}.
 */
class ExclusionListLoaderTest {

    @Test
    @DisplayName("Should load exclusion rows and normalize zero dates")
    void shouldLoadExclusions(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("UPDATED.csv");
        Files.writeString(file, "LASTNAME,FIRSTNAME,MIDNAME,BUSNAME,GENERAL,NPI,STATE,EXCLTYPE,EXCLDATE,REINDATE\n"
                + "DOE,JOHN,Q,,IND,1234567893,NY,1128a1,20190412,00000000\n"
                + ",,,\"ACME HOME CARE, LLC\",ORG,0000000000,FL,1128b4,20180101,20200101\n"
                + "ROE,JANE,,,IND,,TX,1128a2,20170101,00000000\n");

        List<ExclusionRecord> records = ExclusionListLoader.load(file).getRecords();

        assertThat(records).hasSize(3);
        ExclusionRecord doe = records.get(0);
        assertThat(doe.getProviderId()).contains("1234567893");
        assertThat(doe.getName()).isEqualTo("DOE, JOHN");
        assertThat(doe.getExclusionDate()).contains(LocalDate.of(2019, 4, 12));
        assertThat(doe.getReinstatementDate()).isEmpty();
        assertThat(doe.getExclusionType()).isEqualTo("1128a1");

        ExclusionRecord acme = records.get(1);
        assertThat(acme.getName()).isEqualTo("ACME HOME CARE, LLC");
        assertThat(acme.getReinstatementDate()).contains(LocalDate.of(2020, 1, 1));

        assertThat(records.get(2).getProviderId()).isEmpty();
    }
}
