package com.weft.admission;

import java.util.List;

/**
 * Aggregate view over all scored plugins: counts by confidence band (high at or above 0.8, medium
 * from 0.5, low below 0.5) and how many carry a blocking risk level.
 */
public record ConfidenceSummary(
        int totalPlugins,
        double averageConfidence,
        int highConfidenceCount,
        int mediumConfidenceCount,
        int lowConfidenceCount,
        int blockingRiskCount,
        List<ConfidenceRecord> plugins) {

    public ConfidenceSummary {
        plugins = List.copyOf(plugins);
    }
}
