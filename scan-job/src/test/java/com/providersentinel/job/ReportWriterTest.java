package com.providersentinel.job;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.providersentinel.core.model.EntityType;
import com.providersentinel.core.model.Severity;
import com.providersentinel.core.model.SignalHit;
import com.providersentinel.core.model.SignalKind;
import com.providersentinel.core.report.ExecutionMetrics;
import com.providersentinel.core.report.FcaCatalog;
import com.providersentinel.core.report.FlaggedProviderReport;
import com.providersentinel.core.report.FraudScanReport;
import com.providersentinel.core.report.SignalEvidence;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ReportWriter}.
 */
class ReportWriterTest {

    private final ObjectMapper reader = new ObjectMapper();

    @Test
    @DisplayName("Should render snake_case keys, ISO dates and lower-case identifiers")
    void shouldRenderReportShape() throws IOException {
        JsonNode root = reader.readTree(new ReportWriter().toJson(sampleReport()));

        assertThat(root.get("generated_at").asText()).isEqualTo("2024-03-01T12:00:00Z");
        assertThat(root.get("tool_version").asText()).isEqualTo(FraudScanReport.TOOL_VERSION);
        assertThat(root.get("total_providers_scanned").asLong()).isEqualTo(42);
        assertThat(root.get("total_providers_flagged").asInt()).isEqualTo(1);
        assertThat(root.get("signal_counts").get("excluded_provider").asLong()).isEqualTo(1);
        assertThat(root.get("overlap_counts").get("1").asLong()).isEqualTo(1);
        assertThat(root.get("execution_metrics").get("detector_threads").asInt()).isEqualTo(4);

        JsonNode provider = root.get("flagged_providers").get(0);
        assertThat(provider.get("npi").asText()).isEqualTo("1234567893");
        assertThat(provider.get("highest_severity").asText()).isEqualTo("critical");
        assertThat(provider.get("entity_type").asText()).isEqualTo("individual");
        assertThat(provider.has("signal_kinds")).isFalse();
        assertThat(provider.get("total_unique_beneficiaries_all_time").asLong()).isEqualTo(7);
        assertThat(provider.get("fca_relevance").get("statute_reference").asText())
                .isEqualTo("31 U.S.C. § 3729(a)(1)(A)");

        JsonNode signal = provider.get("signals").get(0);
        assertThat(signal.get("signal_type").asText()).isEqualTo("excluded_provider");
        assertThat(signal.get("evidence").get("exclusion_date").asText()).isEqualTo("2020-01-01");
        assertThat(signal.get("evidence").get("first_post_exclusion_month").asText()).isEqualTo("2021-06");
        assertThat(signal.get("evidence").get("reinstatement_date").isNull()).isTrue();
    }

    @Test
    @DisplayName("Should create missing parent directories when writing")
    void shouldCreateParentDirectories(@TempDir Path dir) throws IOException {
        Path target = dir.resolve("nested/out/fraud_signals.json");

        new ReportWriter().write(sampleReport(), target);

        assertThat(target).exists();
        assertThat(reader.readTree(Files.readString(target)).get("flagged_providers").size()).isEqualTo(1);
    }

    // ---------------------------------------------------------------
    // Helper
    // ---------------------------------------------------------------

    private static FraudScanReport sampleReport() {
        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("exclusion_date", LocalDate.of(2020, 1, 1));
        evidence.put("reinstatement_date", null);
        evidence.put("first_post_exclusion_month", YearMonth.of(2021, 6));
        SignalHit hit = SignalHit.builder()
                .providerId("1234567893")
                .kind(SignalKind.EXCLUDED_PROVIDER)
                .severity(Severity.CRITICAL)
                .evidence(evidence)
                .estimatedOverpayment(500.0)
                .build();

        FlaggedProviderReport flagged = FlaggedProviderReport.builder()
                .npi("1234567893")
                .providerName("DOE, JOHN")
                .entityType(EntityType.INDIVIDUAL)
                .totalUniqueBeneficiariesAllTime(7)
                .signals(List.of(new SignalEvidence(hit, FcaCatalog.relevanceFor(hit, "NY"))))
                .estimatedOverpaymentUsd(500.0)
                .highestSeverity(Severity.CRITICAL)
                .fcaRelevance(FcaCatalog.relevanceFor(hit, "NY"))
                .build();

        Map<String, Long> counts = new LinkedHashMap<>();
        for (SignalKind kind : SignalKind.values()) {
            counts.put(kind.getId(), kind == SignalKind.EXCLUDED_PROVIDER ? 1L : 0L);
        }
        return new FraudScanReport(Instant.parse("2024-03-01T12:00:00Z"), 42, counts,
                Map.of(1, 1L), List.of(), List.of(flagged),
                new ExecutionMetrics(1.5, 128.0, 4, 0, Map.of("excluded_provider", 3L)));
    }
}
