package com.weft.discovery;

import java.util.List;
import java.util.Objects;

/**
 * One ranked result of {@link DiscoveryIndex#query(String, int)}. Immutable.
 */
public final class DiscoveryCandidate {

    private final String pluginId;
    private final String description;
    private final String summary;
    private final String category;
    private final List<String> tags;
    private final List<String> capabilities;
    private final List<String> goals;
    private final double relevance;
    private final long usageCount;
    private final double successRate;
    private final MatchType matchType;

    DiscoveryCandidate(IndexedPlugin plugin, double relevance, MatchType matchType) {
        this.pluginId = plugin.getPluginId();
        this.description = plugin.getDescription();
        this.summary = plugin.getSummary();
        this.category = plugin.getCategory();
        this.tags = plugin.getTags();
        this.capabilities = plugin.getCapabilities();
        this.goals = plugin.getGoals();
        this.relevance = relevance;
        this.usageCount = plugin.getStatistics().getUsageCount();
        this.successRate = plugin.getStatistics().getSuccessRate();
        this.matchType = Objects.requireNonNull(matchType, "matchType");
    }

    public String getPluginId() {
        return pluginId;
    }

    public String getDescription() {
        return description;
    }

    public String getSummary() {
        return summary;
    }

    public String getCategory() {
        return category;
    }

    public List<String> getTags() {
        return tags;
    }

    public List<String> getCapabilities() {
        return capabilities;
    }

    public List<String> getGoals() {
        return goals;
    }

    public double getRelevance() {
        return relevance;
    }

    public long getUsageCount() {
        return usageCount;
    }

    public double getSuccessRate() {
        return successRate;
    }

    public MatchType getMatchType() {
        return matchType;
    }

    @Override
    public String toString() {
        return "DiscoveryCandidate{" + pluginId + ", relevance=" + relevance + ", " + matchType + "}";
    }
}
