package com.weft.admission;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of a plugin's confidence ledger. Confidence and risk are meaningful only when
 * {@link #isScored()}; unscored snapshots still carry runtime metrics.
 */
public final class ConfidenceRecord {

    private final String pluginId;
    private final boolean scored;
    private final double confidenceScore;
    private final double baselineScore;
    private final RiskLevel riskLevel;
    private final double averageExecutionTime;
    private final double errorFrequency;
    private final long usageCount;
    private final double successRate;
    private final List<String> recommendations;
    private final ExecutionErrorInfo lastError;
    private final Instant lastUpdated;
    private final PerformanceTrend performanceTrend;
    private final Map<String, Long> commonErrors;
    private final List<Double> recentExecutionTimes;

    ConfidenceRecord(String pluginId, boolean scored, double confidenceScore, double baselineScore,
                     RiskLevel riskLevel, double averageExecutionTime, double errorFrequency, long usageCount,
                     double successRate, List<String> recommendations, ExecutionErrorInfo lastError,
                     Instant lastUpdated, PerformanceTrend performanceTrend, Map<String, Long> commonErrors,
                     List<Double> recentExecutionTimes) {
        this.pluginId = pluginId;
        this.scored = scored;
        this.confidenceScore = confidenceScore;
        this.baselineScore = baselineScore;
        this.riskLevel = riskLevel;
        this.averageExecutionTime = averageExecutionTime;
        this.errorFrequency = errorFrequency;
        this.usageCount = usageCount;
        this.successRate = successRate;
        this.recommendations = List.copyOf(recommendations);
        this.lastError = lastError;
        this.lastUpdated = lastUpdated;
        this.performanceTrend = performanceTrend;
        this.commonErrors = Collections.unmodifiableMap(new LinkedHashMap<>(commonErrors));
        this.recentExecutionTimes = List.copyOf(recentExecutionTimes);
    }

    public String getPluginId() {
        return pluginId;
    }

    public boolean isScored() {
        return scored;
    }

    public AdmissionState getState() {
        return scored ? AdmissionState.SCORED : AdmissionState.UNSCORED;
    }

    public double getConfidenceScore() {
        return confidenceScore;
    }

    /** Last confidence reported by static analysis. */
    public double getBaselineScore() {
        return baselineScore;
    }

    /** Null while unscored. */
    public RiskLevel getRiskLevel() {
        return riskLevel;
    }

    /** Seconds, cumulative average. */
    public double getAverageExecutionTime() {
        return averageExecutionTime;
    }

    /** Fraction of failures over the recent execution window. */
    public double getErrorFrequency() {
        return errorFrequency;
    }

    public long getUsageCount() {
        return usageCount;
    }

    public double getSuccessRate() {
        return successRate;
    }

    public List<String> getRecommendations() {
        return recommendations;
    }

    /** Null when no execution has failed yet. */
    public ExecutionErrorInfo getLastError() {
        return lastError;
    }

    public Instant getLastUpdated() {
        return lastUpdated;
    }

    public PerformanceTrend getPerformanceTrend() {
        return performanceTrend;
    }

    /** Up to three error types with their failure counts, most frequent first. */
    public Map<String, Long> getCommonErrors() {
        return commonErrors;
    }

    /** Seconds of the most recent executions, newest first. */
    public List<Double> getRecentExecutionTimes() {
        return recentExecutionTimes;
    }

    @Override
    public String toString() {
        return "ConfidenceRecord{" + pluginId + ", scored=" + scored + ", confidence=" + confidenceScore
                + ", risk=" + riskLevel + ", usage=" + usageCount + ", errorFrequency=" + errorFrequency
                + ", trend=" + performanceTrend + "}";
    }
}
