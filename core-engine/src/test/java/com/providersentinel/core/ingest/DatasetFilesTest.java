package com.providersentinel.core.ingest;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DatasetFiles} and {@link DatasetLoader}.
 */
class DatasetFilesTest {

    @TempDir
    Path dir;

    @Test
    @DisplayName("Should locate the registry file and skip its header companion")
    void shouldLocateSources() throws IOException {
        touch(DatasetFiles.CLAIMS_FILE);
        touch(DatasetFiles.EXCLUSIONS_FILE);
        touch("npidata_pfile_20050523-20240211_fileheader.csv");
        touch("npidata_pfile_20050523-20240211.csv");

        DatasetFiles files = DatasetFiles.locate(dir);

        assertThat(files.getClaims()).isEqualTo(dir.resolve("claims.csv"));
        assertThat(files.getRegistry().getFileName())
                .hasToString("npidata_pfile_20050523-20240211.csv");
    }

    @Test
    @DisplayName("Should fail when the registry file is missing")
    void shouldFailWithoutRegistry() throws IOException {
        touch(DatasetFiles.CLAIMS_FILE);
        touch(DatasetFiles.EXCLUSIONS_FILE);
        touch("npidata_pfile_x_fileheader.csv");

        assertThatThrownBy(() -> DatasetFiles.locate(dir))
                .isInstanceOf(DatasetLoadException.class)
                .hasMessageContaining("npidata_pfile");
    }

    @Test
    @DisplayName("Should fail when the claims file is missing")
    void shouldFailWithoutClaims() throws IOException {
        touch(DatasetFiles.EXCLUSIONS_FILE);
        touch("npidata_pfile_1.csv");

        assertThatThrownBy(() -> DatasetLoader.load(dir))
                .isInstanceOf(DatasetLoadException.class)
                .hasMessageContaining("claims.csv");
    }

    @Test
    @DisplayName("Should fail when the data directory does not exist")
    void shouldFailForMissingDirectory() {
        assertThatThrownBy(() -> DatasetFiles.locate(dir.resolve("nowhere")))
                .isInstanceOf(DatasetLoadException.class)
                .hasMessageContaining("Data directory not found");
    }

    @Test
    @DisplayName("Should load all three sources and total the skipped rows")
    void shouldLoadAllSources() throws IOException {
        Files.writeString(dir.resolve(DatasetFiles.CLAIMS_FILE),
                "billing_provider_npi,service_month,paid_amount\n1234567893,2023-01,10\nbad,,\n");
        Files.writeString(dir.resolve(DatasetFiles.EXCLUSIONS_FILE),
                "LASTNAME,FIRSTNAME,BUSNAME,NPI,STATE,EXCLTYPE,EXCLDATE,REINDATE\n"
                        + "DOE,JOHN,,1234567893,NY,1128a1,2019041,00000000\n");
        Files.writeString(dir.resolve("npidata_pfile_1.csv"),
                "NPI,Entity Type Code\n1234567893,1\n");

        RawDatasets datasets = DatasetLoader.load(dir);

        assertThat(datasets.getClaims().getRecords()).hasSize(1);
        assertThat(datasets.getExclusions().getRecords()).isEmpty();
        assertThat(datasets.getRegistry().getRecords()).hasSize(1);
        assertThat(datasets.getTotalRowsSkipped()).isEqualTo(2);
    }

    private void touch(String name) throws IOException {
        Files.writeString(dir.resolve(name), "");
    }
}
