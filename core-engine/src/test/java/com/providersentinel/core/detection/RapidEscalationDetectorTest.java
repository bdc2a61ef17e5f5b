package com.providersentinel.core.detection;

import com.providersentinel.core.model.EntityType;
import com.providersentinel.core.model.RegistryEntity;
import com.providersentinel.core.model.Severity;
import com.providersentinel.core.model.SignalHit;
import com.providersentinel.core.model.SignalKind;
import com.providersentinel.core.model.SignalRule;
import com.providersentinel.core.support.TestDatasets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

import static com.providersentinel.core.support.TestDatasets.dataset;
import static com.providersentinel.core.support.TestDatasets.npi;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link RapidEscalationDetector}.
 */
class RapidEscalationDetectorTest {

    private RapidEscalationDetector detector;

    @BeforeEach
    void setUp() {
        detector = new RapidEscalationDetector(SignalRule.of(SignalKind.RAPID_ESCALATION));
    }

    @Test
    @DisplayName("Should flag 300% growth over the trailing three-month average")
    void shouldFlagRapidGrowth() {
        String id = npi(1);
        List<SignalHit> hits = detector.detect(newlyEnrolled(id, "2023-01-15", 100, 100, 100, 400).resolve());

        assertThat(hits).hasSize(1);
        SignalHit hit = hits.get(0);
        assertThat(hit.getProviderId()).isEqualTo(id);
        assertThat(hit.getSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat((Double) hit.getEvidence().get("peak_growth_pct")).isCloseTo(300.0, within(1e-9));
        assertThat(hit.getEvidence())
                .containsEntry("peak_month", YearMonth.of(2023, 5))
                .containsEntry("first_billing_month", YearMonth.of(2023, 2))
                .containsEntry("months_above_threshold", 1)
                .containsEntry("enumeration_date", LocalDate.of(2023, 1, 15));
        assertThat(hit.getEstimatedOverpayment()).isCloseTo(300.0, within(1e-9));
    }

    @Test
    @DisplayName("Should not flag 50% growth")
    void shouldNotFlagModestGrowth() {
        assertThat(detector.detect(newlyEnrolled(npi(1), "2023-01-15", 100, 100, 100, 150).resolve())).isEmpty();
    }

    @Test
    @DisplayName("Should mark growth above 500% as high severity")
    void shouldMarkExtremeGrowthHigh() {
        List<SignalHit> hits = detector.detect(newlyEnrolled(npi(1), "2023-01-15", 100, 100, 100, 700).resolve());

        assertThat(hits).singleElement()
                .extracting(SignalHit::getSeverity)
                .isEqualTo(Severity.HIGH);
    }

    @Test
    @DisplayName("Should skip providers enumerated before the enrollment window")
    void shouldSkipEstablishedProviders() {
        assertThat(detector.detect(newlyEnrolled(npi(1), "2019-01-01", 100, 100, 100, 400).resolve())).isEmpty();
    }

    @Test
    @DisplayName("Should skip providers without an enumeration date")
    void shouldSkipWithoutEnumerationDate() {
        String id = npi(1);
        TestDatasets data = dataset().registry(RegistryEntity.builder()
                .providerId(id)
                .entityType(EntityType.ORGANIZATION)
                .build());
        addSeries(data, id, 100, 100, 100, 400);

        assertThat(detector.detect(data.resolve())).isEmpty();
    }

    @Test
    @DisplayName("Should not flag modest growth across months without claims")
    void shouldNotFlagGrowthAcrossGapMonths() {
        String id = npi(1);
        TestDatasets data = dataset().registry(RegistryEntity.builder()
                        .providerId(id)
                        .entityType(EntityType.ORGANIZATION)
                        .name("New Care LLC")
                        .enumerationDate(LocalDate.of(2023, 1, 1))
                        .build())
                .claim(id, "2023-02", 1000)
                .claim(id, "2023-05", 1100);

        assertThat(detector.detect(data.resolve())).isEmpty();
    }

    @Test
    @DisplayName("Should average over the preceding billed months only")
    void shouldAverageOverBilledMonthsOnly() {
        SortedMap<YearMonth, Double> series = new TreeMap<>();
        series.put(YearMonth.of(2023, 1), 100.0);
        series.put(YearMonth.of(2023, 3), 100.0);
        series.put(YearMonth.of(2023, 6), 100.0);
        series.put(YearMonth.of(2023, 9), 400.0);

        RapidEscalationDetector.Escalation escalation = detector.measure(series);

        assertThat(escalation.peakGrowth).isCloseTo(3.0, within(1e-9));
        assertThat(escalation.peakMonth).isEqualTo(YearMonth.of(2023, 9));
        assertThat(escalation.firstMonth).isEqualTo(YearMonth.of(2023, 1));
        assertThat(escalation.series).containsOnlyKeys("2023-01", "2023-03", "2023-06", "2023-09");
    }

    @Test
    @DisplayName("Should return no measurement without a full trailing window")
    void shouldRequireFullTrailingWindow() {
        SortedMap<YearMonth, Double> series = new TreeMap<>();
        series.put(YearMonth.of(2023, 1), 100.0);
        series.put(YearMonth.of(2023, 2), 900.0);

        assertThat(detector.measure(series)).isNull();
    }

    // ---------------------------------------------------------------
    // Helper
    // ---------------------------------------------------------------

    /** Registry entry enumerated on {@code enumerated} billing from 2023-02 onwards. */
    private static TestDatasets newlyEnrolled(String id, String enumerated, double... monthly) {
        TestDatasets data = dataset().registry(RegistryEntity.builder()
                .providerId(id)
                .entityType(EntityType.ORGANIZATION)
                .name("New Care LLC")
                .enumerationDate(LocalDate.parse(enumerated))
                .build());
        addSeries(data, id, monthly);
        return data;
    }

    private static void addSeries(TestDatasets data, String id, double... monthly) {
        YearMonth month = YearMonth.of(2023, 2);
        for (double paid : monthly) {
            data.claim(id, month.toString(), paid);
            month = month.plusMonths(1);
        }
    }
}
