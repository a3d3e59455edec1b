package com.weft.discovery;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Persisted metadata of one indexed plugin: the text used for matching, the derived goal fragments,
 * the content hash used to skip unchanged re-indexing, and outcome statistics.
 */
public final class IndexedPlugin {

    private final String pluginId;
    private final String description;
    private final String summary;
    private final String category;
    private final List<String> tags;
    private final List<String> capabilities;
    private final List<String> goals;
    private final String contentHash;
    private final PluginStatistics statistics;
    private final Instant lastIndexed;

    public IndexedPlugin(String pluginId, String description, String summary, String category,
                         List<String> tags, List<String> capabilities, List<String> goals,
                         String contentHash, PluginStatistics statistics, Instant lastIndexed) {
        this.pluginId = Objects.requireNonNull(pluginId, "pluginId");
        this.description = description != null ? description : "";
        this.summary = summary != null ? summary : "";
        this.category = category;
        this.tags = tags != null ? List.copyOf(tags) : List.of();
        this.capabilities = capabilities != null ? List.copyOf(capabilities) : List.of();
        this.goals = goals != null ? List.copyOf(goals) : List.of();
        this.contentHash = contentHash;
        this.statistics = statistics != null ? statistics : PluginStatistics.INITIAL;
        this.lastIndexed = lastIndexed;
    }

    /** Copy with new statistics; everything else unchanged. */
    public IndexedPlugin withStatistics(PluginStatistics newStatistics) {
        return new IndexedPlugin(pluginId, description, summary, category, tags, capabilities, goals,
                contentHash, newStatistics, lastIndexed);
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

    public String getContentHash() {
        return contentHash;
    }

    public PluginStatistics getStatistics() {
        return statistics;
    }

    public Instant getLastIndexed() {
        return lastIndexed;
    }

    @Override
    public String toString() {
        return "IndexedPlugin{" + pluginId + ", goals=" + goals.size() + ", " + statistics + "}";
    }
}
