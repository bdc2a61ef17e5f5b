package com.providersentinel.core.detection;

import com.providersentinel.core.config.SignalRulesConfig;
import com.providersentinel.core.model.Severity;
import com.providersentinel.core.model.SignalHit;
import com.providersentinel.core.model.SignalKind;
import com.providersentinel.core.model.SignalRule;
import com.providersentinel.core.resolve.ResolvedDataset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.providersentinel.core.support.TestDatasets.dataset;
import static com.providersentinel.core.support.TestDatasets.npi;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SignalEngine}.
 */
class SignalEngineTest {

    @Test
    @DisplayName("Should keep the hits of healthy detectors when one detector fails")
    void shouldIsolateDetectorFailure() {
        String id = npi(1);
        ResolvedDataset data = dataset()
                .excluded(id, "2020-01-01", null)
                .claim(id, "2021-06", 500.0)
                .resolve();
        SignalEngine engine = new SignalEngine(List.of(
                new ExcludedProviderDetector(SignalRule.of(SignalKind.EXCLUDED_PROVIDER)),
                new FixedDetector(SignalKind.BILLING_OUTLIER, null),
                new FixedDetector(SignalKind.SHARED_OFFICIAL, List.of(hit(npi(2), SignalKind.SHARED_OFFICIAL)))),
                2);

        EngineResult result = engine.run(data);

        assertThat(result.getFailedSignals()).containsExactly(SignalKind.BILLING_OUTLIER);
        assertThat(result.getHits(SignalKind.EXCLUDED_PROVIDER)).extracting(SignalHit::getProviderId)
                .containsExactly(id);
        assertThat(result.getHits(SignalKind.SHARED_OFFICIAL)).hasSize(1);
        assertThat(result.getHits(SignalKind.BILLING_OUTLIER)).isEmpty();
        assertThat(result.getAllHits()).hasSize(2);
    }

    @Test
    @DisplayName("Should produce the same hits regardless of pool size")
    void shouldBeIndependentOfThreadCount() {
        ResolvedDataset data = dataset()
                .excluded(npi(1), "2020-01-01", null)
                .claim(npi(1), "2021-06", 500.0)
                .claims(npi(2), "2022-01", 150, 10.0, "G0151", 3)
                .resolve();
        List<SignalDetector> detectors = SignalDetectorFactory.createAll(
                SignalRulesConfig.defaults().getRules());

        EngineResult single = new SignalEngine(detectors, 1).run(data);
        EngineResult parallel = new SignalEngine(detectors, 6).run(data);

        assertThat(parallel.getAllHits()).containsExactlyElementsOf(single.getAllHits());
        assertThat(single.getFailedSignals()).isEmpty();
    }

    @Test
    @DisplayName("Should reject two detectors of the same kind")
    void shouldRejectDuplicateKinds() {
        assertThatThrownBy(() -> new SignalEngine(List.of(
                new FixedDetector(SignalKind.SHARED_OFFICIAL, List.of()),
                new FixedDetector(SignalKind.SHARED_OFFICIAL, List.of())), 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("shared_official");
    }

    @Test
    @DisplayName("Should reject a pool size below one")
    void shouldRejectZeroThreads() {
        assertThatThrownBy(() -> new SignalEngine(List.of(), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ---------------------------------------------------------------
    // Helper
    // ---------------------------------------------------------------

    private static SignalHit hit(String id, SignalKind kind) {
        return SignalHit.builder().providerId(id).kind(kind).severity(Severity.MEDIUM).build();
    }

    /** Returns canned hits, or throws when none are given. */
    private static final class FixedDetector implements SignalDetector {

        private final SignalKind kind;
        private final List<SignalHit> hits;

        FixedDetector(SignalKind kind, List<SignalHit> hits) {
            this.kind = kind;
            this.hits = hits;
        }

        @Override
        public List<SignalHit> detect(ResolvedDataset dataset) {
            if (hits == null) {
                throw new IllegalStateException("boom");
            }
            return hits;
        }

        @Override
        public SignalKind getKind() {
            return kind;
        }

        @Override
        public String getRuleName() {
            return "fixed_" + kind.getId();
        }
    }
}
