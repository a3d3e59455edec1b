package com.weft.admission;

import java.util.List;

/**
 * Thrown when the admission gate vetoes a plugin at run time. Carries the risk and confidence that
 * caused the veto and the identities of better-scored alternatives.
 */
public class PluginBlockedException extends RuntimeException {

    private final String pluginId;
    private final RiskLevel riskLevel;
    private final double confidenceScore;
    private final List<String> alternatives;

    public PluginBlockedException(AdmissionDecision decision) {
        super(decision.getMessage() != null ? decision.getMessage() : "Plugin blocked: " + decision.getPluginId());
        this.pluginId = decision.getPluginId();
        this.riskLevel = decision.getRiskLevel();
        this.confidenceScore = decision.getConfidenceScore();
        this.alternatives = decision.getAlternatives().stream().map(ConfidenceRecord::getPluginId).toList();
    }

    public String getPluginId() {
        return pluginId;
    }

    public RiskLevel getRiskLevel() {
        return riskLevel;
    }

    public double getConfidenceScore() {
        return confidenceScore;
    }

    public List<String> getAlternatives() {
        return alternatives;
    }
}
