package com.providersentinel.core.report;

import com.providersentinel.core.model.Severity;
import com.providersentinel.core.model.SignalHit;
import com.providersentinel.core.model.SignalKind;

import java.util.Map;
import java.util.Objects;

/**
 * One signal entry of a flagged provider: the hit itself plus its FCA
 * relevance.
 *
 * @since 1.0.0
 */
public final class SignalEvidence {

    private final SignalKind signalType;
    private final Severity severity;
    private final Map<String, Object> evidence;
    private final double estimatedOverpayment;
    private final FcaRelevance fcaRelevance;

    public SignalEvidence(SignalHit hit, FcaRelevance fcaRelevance) {
        Objects.requireNonNull(hit, "hit must not be null");
        this.signalType = hit.getKind();
        this.severity = hit.getSeverity();
        this.evidence = hit.getEvidence();
        this.estimatedOverpayment = hit.getEstimatedOverpayment();
        this.fcaRelevance = Objects.requireNonNull(fcaRelevance, "fcaRelevance must not be null");
    }

    public SignalKind getSignalType() {
        return signalType;
    }

    public Severity getSeverity() {
        return severity;
    }

    public Map<String, Object> getEvidence() {
        return evidence;
    }

    public double getEstimatedOverpayment() {
        return estimatedOverpayment;
    }

    public FcaRelevance getFcaRelevance() {
        return fcaRelevance;
    }

    @Override
    public String toString() {
        return "SignalEvidence{" +
                "signalType=" + signalType +
                ", severity=" + severity +
                ", estimatedOverpayment=" + estimatedOverpayment +
                '}';
    }
}
