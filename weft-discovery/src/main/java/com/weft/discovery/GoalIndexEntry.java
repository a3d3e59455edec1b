package com.weft.discovery;

import java.util.Objects;

/**
 * One goal-pattern mapping: a normalized fragment (e.g. "analyze performance") pointing at a plugin
 * with a relevance in [0, 1].
 */
public final class GoalIndexEntry {

    private final String goalPattern;
    private final String pluginId;
    private final double relevance;

    public GoalIndexEntry(String goalPattern, String pluginId, double relevance) {
        this.goalPattern = Objects.requireNonNull(goalPattern, "goalPattern");
        this.pluginId = Objects.requireNonNull(pluginId, "pluginId");
        this.relevance = Math.max(0.0, Math.min(1.0, relevance));
    }

    public String getGoalPattern() {
        return goalPattern;
    }

    public String getPluginId() {
        return pluginId;
    }

    public double getRelevance() {
        return relevance;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GoalIndexEntry that = (GoalIndexEntry) o;
        return Double.compare(that.relevance, relevance) == 0
                && goalPattern.equals(that.goalPattern)
                && pluginId.equals(that.pluginId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(goalPattern, pluginId, relevance);
    }

    @Override
    public String toString() {
        return "GoalIndexEntry{" + goalPattern + " -> " + pluginId + " (" + relevance + ")}";
    }
}
