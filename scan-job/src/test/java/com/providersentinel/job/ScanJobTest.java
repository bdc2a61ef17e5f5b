package com.providersentinel.job;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.providersentinel.core.report.FlaggedProviderReport;
import com.providersentinel.core.report.FraudScanReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests for {@link ScanJob} over small on-disk datasets.
 */
class ScanJobTest {

    private static final String EXCLUDED = "1000000001";
    private static final String CLEAN = "1000000002";

    @TempDir
    Path dir;

    private Path dataDir;
    private Path output;

    @BeforeEach
    void setUp() throws IOException {
        dataDir = Files.createDirectories(dir.resolve("data"));
        output = dir.resolve("out/fraud_signals.json");
    }

    @Test
    @DisplayName("Should write a report flagging the excluded and shared-official providers")
    void shouldScanAndWriteReport() throws IOException {
        writeInputs();

        int status = new ScanJob(config(2)).run();

        assertThat(status).isEqualTo(ScanJob.EXIT_OK);
        JsonNode root = new ObjectMapper().readTree(Files.readString(output));
        assertThat(root.get("total_providers_flagged").asInt()).isEqualTo(6);
        assertThat(root.get("signal_counts").get("excluded_provider").asInt()).isEqualTo(1);
        assertThat(root.get("signal_counts").get("shared_official").asInt()).isEqualTo(5);
        assertThat(root.get("signal_counts").size()).isEqualTo(6);
        assertThat(root.get("execution_metrics").get("rows_skipped").asLong()).isEqualTo(1);

        JsonNode first = root.get("flagged_providers").get(0);
        assertThat(first.get("npi").asText()).isEqualTo(EXCLUDED);
        assertThat(first.get("provider_name").asText()).isEqualTo("DOE, JOHN");
        assertThat(first.get("estimated_overpayment_usd").asDouble()).isEqualTo(500.0);
    }

    @Test
    @DisplayName("Should produce the same flagged providers for any thread count")
    void shouldBeDeterministicAcrossThreadCounts() throws IOException {
        writeInputs();

        FraudScanReport single = new ScanJob(config(1)).scan();
        FraudScanReport parallel = new ScanJob(config(6)).scan();

        assertThat(parallel.getFlaggedProviders()).extracting(FlaggedProviderReport::getNpi)
                .containsExactlyElementsOf(single.getFlaggedProviders().stream()
                        .map(FlaggedProviderReport::getNpi).toList());
        assertThat(parallel.getSignalCounts()).isEqualTo(single.getSignalCounts());
        assertThat(parallel.getFlaggedProviders()).extracting(FlaggedProviderReport::getNpi)
                .doesNotContain(CLEAN);
    }

    @Test
    @DisplayName("Should honour an external rules file that disables detectors")
    void shouldUseExternalRules() throws IOException {
        writeInputs();
        Path rules = dir.resolve("rules.yml");
        Files.writeString(rules, "rules:\n  - name: excluded_only\n    type: excluded_provider\n");

        FraudScanReport report = new ScanJob(new JobConfig.Builder()
                .dataDir(dataDir)
                .outputPath(output)
                .detectorThreads(1)
                .signalsConfigPath(rules.toString())
                .build()).scan();

        assertThat(report.getTotalProvidersFlagged()).isEqualTo(1);
        assertThat(report.getSignalCounts()).containsEntry("shared_official", 0L);
    }

    @Test
    @DisplayName("Should exit with status 1 and write nothing when an input is missing")
    void shouldFailWithoutInputs() throws IOException {
        Files.writeString(dataDir.resolve("claims.csv"), "billing_provider_npi,service_month,paid_amount\n");

        int status = new ScanJob(config(2)).run();

        assertThat(status).isEqualTo(ScanJob.EXIT_FAILURE);
        assertThat(output).doesNotExist();
    }

    // ---------------------------------------------------------------
    // Helper
    // ---------------------------------------------------------------

    private JobConfig config(int threads) {
        return new JobConfig.Builder()
                .dataDir(dataDir)
                .outputPath(output)
                .detectorThreads(threads)
                .build();
    }

    private void writeInputs() throws IOException {
        StringBuilder claims = new StringBuilder(
                "billing_provider_npi,servicing_provider_npi,service_month,hcpcs_code,paid_amount,beneficiary_id\n");
        claims.append(EXCLUDED).append(",,2021-06,99213,500,B1\n");
        claims.append(CLEAN).append(",,2021-06,99213,80,B2\n");
        claims.append("0000000000,,2021-06,99213,80,B3\n");
        claims.append("1000000010,,not-a-month,99213,80,B4\n");
        for (int i = 11; i <= 15; i++) {
            claims.append("10000000").append(i).append(",,2021-06,T1019,300000,B").append(i).append('\n');
        }
        Files.writeString(dataDir.resolve("claims.csv"), claims.toString());

        Files.writeString(dataDir.resolve("UPDATED.csv"),
                "LASTNAME,FIRSTNAME,MIDNAME,BUSNAME,NPI,STATE,EXCLTYPE,EXCLDATE,REINDATE\n"
                        + "DOE,JOHN,,," + EXCLUDED + ",NY,1128a1,20200101,00000000\n"
                        + "ROE,JANE,,,,TX,1128a1,20190101,00000000\n");

        StringBuilder registry = new StringBuilder("NPI,Entity Type Code,"
                + "Provider Organization Name (Legal Business Name),Provider Last Name (Legal Name),"
                + "Provider First Name,Provider Business Practice Location Address State Name,"
                + "Healthcare Provider Taxonomy Code_1,Provider Enumeration Date,"
                + "Authorized Official Last Name,Authorized Official First Name\n");
        registry.append(CLEAN).append(",1,,ROE,RICHARD,NY,207Q00000X,05/01/2010,,\n");
        for (int i = 11; i <= 15; i++) {
            registry.append("10000000").append(i)
                    .append(",2,Care Group ").append(i).append(",,,NY,251E00000X,01/01/2012,Smith,Jane\n");
        }
        Files.writeString(dataDir.resolve("npidata_pfile_20050523-20240211.csv"), registry.toString());
        Files.writeString(dataDir.resolve("npidata_pfile_20050523-20240211_fileheader.csv"), "NPI\n");
    }
}
