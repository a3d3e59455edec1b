package com.weft.admission;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of {@link AdmissionGate#evaluate(String, boolean)} for one execution attempt.
 * Execution is permitted for ALLOWED, WARNED and UNSCORED; BLOCKED carries up to five alternatives.
 */
public final class AdmissionDecision {

    private final String pluginId;
    private final AdmissionState state;
    private final RiskLevel riskLevel;
    private final double confidenceScore;
    private final String message;
    private final List<ConfidenceRecord> alternatives;

    AdmissionDecision(String pluginId, AdmissionState state, RiskLevel riskLevel, double confidenceScore,
                      String message, List<ConfidenceRecord> alternatives) {
        this.pluginId = pluginId;
        this.state = Objects.requireNonNull(state, "state");
        this.riskLevel = riskLevel;
        this.confidenceScore = confidenceScore;
        this.message = message;
        this.alternatives = alternatives != null ? List.copyOf(alternatives) : List.of();
    }

    public String getPluginId() {
        return pluginId;
    }

    public AdmissionState getState() {
        return state;
    }

    /** Null for an unscored plugin. */
    public RiskLevel getRiskLevel() {
        return riskLevel;
    }

    /** NaN for an unscored plugin. */
    public double getConfidenceScore() {
        return confidenceScore;
    }

    /** Warning or block message; null when allowed. */
    public String getMessage() {
        return message;
    }

    public List<ConfidenceRecord> getAlternatives() {
        return alternatives;
    }

    public boolean isPermitted() {
        return state != AdmissionState.BLOCKED;
    }

    public boolean isBlocked() {
        return state == AdmissionState.BLOCKED;
    }

    public boolean isWarned() {
        return state == AdmissionState.WARNED;
    }

    @Override
    public String toString() {
        return "AdmissionDecision{" + pluginId + ", " + state + ", risk=" + riskLevel
                + ", confidence=" + confidenceScore + "}";
    }
}
