package com.providersentinel.core.detection;

import com.providersentinel.core.model.Severity;
import com.providersentinel.core.model.SignalHit;
import com.providersentinel.core.model.SignalKind;
import com.providersentinel.core.model.SignalRule;
import com.providersentinel.core.support.TestDatasets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.providersentinel.core.support.TestDatasets.dataset;
import static com.providersentinel.core.support.TestDatasets.npi;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SharedOfficialDetector}.
 */
class SharedOfficialDetectorTest {

    private SharedOfficialDetector detector;

    @BeforeEach
    void setUp() {
        detector = new SharedOfficialDetector(SignalRule.of(SignalKind.SHARED_OFFICIAL));
    }

    @Test
    @DisplayName("Should flag every member of a five-organization group above $1M")
    void shouldFlagAllMembersOfLargeGroup() {
        TestDatasets data = dataset();
        for (int i = 1; i <= 5; i++) {
            String id = npi(i);
            data.organization(id, "Smith", "Jane")
                    .claim(id, "2023-01", i == 1 ? 200_001.0 : 200_000.0);
        }

        List<SignalHit> hits = detector.detect(data.resolve());

        assertThat(hits).extracting(SignalHit::getProviderId)
                .containsExactly(npi(1), npi(2), npi(3), npi(4), npi(5));
        SignalHit hit = hits.get(0);
        assertThat(hit.getSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat(hit.getEstimatedOverpayment()).isZero();
        assertThat(hit.getEvidence())
                .containsEntry("authorized_official", "SMITH, JANE")
                .containsEntry("member_count", 5)
                .containsEntry("combined_total_paid", 1_000_001.0);
        assertThat(hits).allSatisfy(h -> assertThat(h.getEvidence().get("member_ids"))
                .isEqualTo(List.of(npi(1), npi(2), npi(3), npi(4), npi(5))));
    }

    @Test
    @DisplayName("Should not flag a four-organization group regardless of volume")
    void shouldNotFlagSmallGroup() {
        TestDatasets data = dataset();
        for (int i = 1; i <= 4; i++) {
            String id = npi(i);
            data.organization(id, "Smith", "Jane").claim(id, "2023-01", 500_000.0);
        }

        assertThat(detector.detect(data.resolve())).isEmpty();
    }

    @Test
    @DisplayName("Should not flag a group at exactly $1M combined")
    void shouldRequireCombinedStrictlyAboveFloor() {
        TestDatasets data = dataset();
        for (int i = 1; i <= 5; i++) {
            String id = npi(i);
            data.organization(id, "Smith", "Jane").claim(id, "2023-01", 200_000.0);
        }

        assertThat(detector.detect(data.resolve())).isEmpty();
    }

    @Test
    @DisplayName("Should group official names case-insensitively and ignore blank names")
    void shouldNormalizeOfficialNames() {
        TestDatasets data = dataset();
        String[] lastNames = {"smith", "SMITH", " Smith ", "Smith", "sMiTh"};
        for (int i = 0; i < lastNames.length; i++) {
            String id = npi(i + 1);
            data.organization(id, lastNames[i], "jane").claim(id, "2023-01", 2_000_000.0);
        }
        String unnamed = npi(9);
        data.organization(unnamed, " ", "Jane").claim(unnamed, "2023-01", 2_000_000.0);

        List<SignalHit> hits = detector.detect(data.resolve());

        assertThat(hits).hasSize(5);
        assertThat(hits).extracting(SignalHit::getProviderId).doesNotContain(unnamed);
        assertThat(hits).allSatisfy(h -> assertThat(h.getSeverity()).isEqualTo(Severity.HIGH));
    }
}
