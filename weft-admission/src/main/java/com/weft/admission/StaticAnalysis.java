package com.weft.admission;

import java.util.List;
import java.util.Objects;

/** Result of static analysis of one plugin: baseline confidence, risk and free-text recommendations. */
public final class StaticAnalysis {

    private final double confidenceScore;
    private final RiskLevel riskLevel;
    private final List<String> recommendations;

    public StaticAnalysis(double confidenceScore, RiskLevel riskLevel, List<String> recommendations) {
        this.confidenceScore = AdmissionGate.clamp(confidenceScore);
        this.riskLevel = Objects.requireNonNull(riskLevel, "riskLevel");
        this.recommendations = recommendations != null ? List.copyOf(recommendations) : List.of();
    }

    public StaticAnalysis(double confidenceScore, RiskLevel riskLevel) {
        this(confidenceScore, riskLevel, List.of());
    }

    public double getConfidenceScore() {
        return confidenceScore;
    }

    public RiskLevel getRiskLevel() {
        return riskLevel;
    }

    public List<String> getRecommendations() {
        return recommendations;
    }
}
