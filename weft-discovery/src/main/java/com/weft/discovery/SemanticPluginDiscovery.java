package com.weft.discovery;

import com.weft.config.WeftConfig;
import com.weft.discovery.schema.DiscoverySchemaBootstrapper;
import com.weft.discovery.store.JdbcDiscoveryConnectionProvider;
import com.weft.discovery.store.JdbcDiscoveryStore;
import com.weft.plugin.PluginDescriptor;
import com.weft.plugin.PluginRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Caller-facing discovery: indexes the registry, answers goals with plugin identities or
 * human-readable suggestion text, and remembers the most recent goals asked.
 */
public final class SemanticPluginDiscovery {

    private static final Logger log = LoggerFactory.getLogger(SemanticPluginDiscovery.class);

    static final int GOAL_HISTORY_SIZE = 10;
    private static final int SUGGESTIONS_SHOWN = 3;

    private final DiscoveryIndex index;
    private final int defaultLimit;
    private final Deque<GoalRecord> goalHistory = new ArrayDeque<>();

    public SemanticPluginDiscovery(DiscoveryIndex index, int defaultLimit) {
        this.index = Objects.requireNonNull(index, "index");
        this.defaultLimit = defaultLimit > 0 ? defaultLimit : WeftConfig.DEFAULT_DISCOVERY_LIMIT;
    }

    /**
     * Opens the JDBC-backed index configured by {@code WEFT_DB_URL}, creating the schema if needed.
     */
    public static SemanticPluginDiscovery open(WeftConfig config) {
        Objects.requireNonNull(config, "WeftConfig");
        JdbcDiscoveryConnectionProvider connections = new JdbcDiscoveryConnectionProvider(config);
        new DiscoverySchemaBootstrapper(connections).ensureSchema();
        log.info("Discovery index opened url={}", connections.getUrl());
        return new SemanticPluginDiscovery(
                new SemanticDiscoveryIndex(new JdbcDiscoveryStore(connections)), config.getDiscoveryLimit());
    }

    public DiscoveryIndex getIndex() {
        return index;
    }

    /** Indexes every descriptor in the registry; returns the number indexed. */
    public int indexRegistry(PluginRegistry registry) {
        List<PluginDescriptor> descriptors = new ArrayList<>(registry.descriptors());
        int n = index.indexAll(descriptors);
        log.info("Indexed {}/{} registered plugin(s)", n, descriptors.size());
        return n;
    }

    /** Identities of the best plugins for the goal, at most {@code maxResults}. */
    public List<String> findRelevantPlugins(String goal, int maxResults) {
        List<String> out = new ArrayList<>();
        for (DiscoveryCandidate c : index.query(goal, maxResults)) {
            out.add(c.getPluginId());
        }
        return out;
    }

    /**
     * Suggestion text for a goal, listing up to three plugins with their relevance. The goal is
     * recorded in the history.
     */
    public String describeSuggestions(String goal) {
        remember(goal);
        List<DiscoveryCandidate> candidates = index.query(goal, defaultLimit);
        if (candidates.isEmpty()) {
            return "I couldn't find any plugins specifically for '" + goal
                    + "'. Would you like me to search for related capabilities?";
        }
        if (candidates.size() == 1) {
            DiscoveryCandidate c = candidates.get(0);
            return "I found 1 plugin that can help with '" + goal + "': **" + c.getPluginId() + "** - "
                    + c.getSummary() + " Want to activate it?";
        }
        StringBuilder sb = new StringBuilder("I found ").append(candidates.size())
                .append(" plugins that can help with '").append(goal).append("':\n\n");
        int shown = Math.min(SUGGESTIONS_SHOWN, candidates.size());
        for (int i = 0; i < shown; i++) {
            DiscoveryCandidate c = candidates.get(i);
            if (i > 0) sb.append('\n');
            sb.append(i + 1).append(". **").append(c.getPluginId()).append("** - ").append(c.getSummary())
                    .append(String.format(Locale.ROOT, " (%.1f relevance)", c.getRelevance()));
        }
        if (candidates.size() > SUGGESTIONS_SHOWN) {
            sb.append("\n\n...and ").append(candidates.size() - SUGGESTIONS_SHOWN)
                    .append(" more. Which one would you like to use?");
        } else {
            sb.append("\n\nWhich one would you like to activate?");
        }
        return sb.toString();
    }

    public void recordOutcome(String pluginId, boolean success, double executionTimeSeconds) {
        index.recordOutcome(pluginId, success, executionTimeSeconds);
    }

    /** Most recent goals, oldest first, at most ten. */
    public synchronized List<GoalRecord> getGoalHistory() {
        return new ArrayList<>(goalHistory);
    }

    private synchronized void remember(String goal) {
        if (goal == null || goal.isBlank()) return;
        goalHistory.addLast(new GoalRecord(goal.trim(), Instant.now()));
        while (goalHistory.size() > GOAL_HISTORY_SIZE) {
            goalHistory.removeFirst();
        }
    }

    /** A goal as asked, with the time it was asked. */
    public record GoalRecord(String goal, Instant askedAt) {
    }
}
