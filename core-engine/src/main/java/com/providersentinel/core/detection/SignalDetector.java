package com.providersentinel.core.detection;

import com.providersentinel.core.model.SignalHit;
import com.providersentinel.core.model.SignalKind;
import com.providersentinel.core.resolve.ResolvedDataset;

import java.util.List;

/**
 * Contract for all signal detectors.
 * <p>
 * Implementations are <strong>stateless</strong> pure functions of the
 * resolved dataset: they never mutate it and keep nothing between calls, so
 * several detectors may run concurrently over the same instance.
 * </p>
 */
public interface SignalDetector {

    /**
     * Evaluate the whole dataset.
     *
     * @param dataset the frozen resolved dataset
     * @return hits in provider-identifier order; empty when nothing is flagged
     */
    List<SignalHit> detect(ResolvedDataset dataset);

    /**
     * @return the signal kind this detector produces
     */
    SignalKind getKind();

    /**
     * Return the name of the rule this detector enforces.
     *
     * @return rule name
     */
    String getRuleName();
}
