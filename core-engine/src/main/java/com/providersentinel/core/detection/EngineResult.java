package com.providersentinel.core.detection;

import com.providersentinel.core.model.SignalHit;
import com.providersentinel.core.model.SignalKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one engine run: hits per signal kind, the kinds whose detector
 * failed, and per-detector wall time.
 *
 * @since 1.0.0
 */
public final class EngineResult {

    private final Map<SignalKind, List<SignalHit>> hitsByKind;
    private final List<SignalKind> failedSignals;
    private final Map<SignalKind, Long> detectorMillis;

    public EngineResult(Map<SignalKind, List<SignalHit>> hitsByKind,
            List<SignalKind> failedSignals,
            Map<SignalKind, Long> detectorMillis) {
        Objects.requireNonNull(hitsByKind, "hitsByKind must not be null");
        EnumMap<SignalKind, List<SignalHit>> copy = new EnumMap<>(SignalKind.class);
        hitsByKind.forEach((kind, hits) -> copy.put(kind, List.copyOf(hits)));
        this.hitsByKind = Collections.unmodifiableMap(copy);
        List<SignalKind> failed = new ArrayList<>(Objects.requireNonNull(failedSignals,
                "failedSignals must not be null"));
        Collections.sort(failed);
        this.failedSignals = Collections.unmodifiableList(failed);
        Objects.requireNonNull(detectorMillis, "detectorMillis must not be null");
        this.detectorMillis = detectorMillis.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(detectorMillis));
    }

    /**
     * @return hits keyed by kind, in kind declaration order; kinds that were
     *         not run or failed are absent
     */
    public Map<SignalKind, List<SignalHit>> getHitsByKind() {
        return hitsByKind;
    }

    public List<SignalHit> getHits(SignalKind kind) {
        return hitsByKind.getOrDefault(kind, List.of());
    }

    /**
     * @return every hit, grouped by kind in kind declaration order
     */
    public List<SignalHit> getAllHits() {
        List<SignalHit> all = new ArrayList<>();
        hitsByKind.values().forEach(all::addAll);
        return all;
    }

    public List<SignalKind> getFailedSignals() {
        return failedSignals;
    }

    public Map<SignalKind, Long> getDetectorMillis() {
        return detectorMillis;
    }

    @Override
    public String toString() {
        return "EngineResult{" +
                "hits=" + getAllHits().size() +
                ", kinds=" + hitsByKind.keySet() +
                ", failed=" + failedSignals +
                '}';
    }
}
