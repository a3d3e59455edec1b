package com.weft.discovery.store;

import com.weft.discovery.GoalIndexEntry;
import com.weft.discovery.IndexedPlugin;
import com.weft.discovery.PluginStatistics;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Persistence for the discovery index: plugin metadata with statistics, and goal-pattern mappings.
 * Implementations: {@link JdbcDiscoveryStore} (any JDBC database, embedded H2 by default) and
 * {@link InMemoryDiscoveryStore}. Every method may throw {@link DiscoveryStoreException}.
 */
public interface DiscoveryStore {

    Optional<IndexedPlugin> findPlugin(String pluginId);

    /** All indexed plugins, ordered by identity. */
    List<IndexedPlugin> listPlugins();

    /**
     * Atomically replaces the plugin's metadata row and all of its goal mappings.
     */
    void replacePlugin(IndexedPlugin plugin, List<GoalIndexEntry> goals);

    /** Goal mappings of one plugin. */
    List<GoalIndexEntry> goalMappings(String pluginId);

    /**
     * Goal mappings that may match the goal: the fragment contains the goal, the goal contains the
     * fragment, or (when {@code firstToken} is non-null) the fragment contains the first token.
     * Implementations may return a superset; callers re-check with {@link GoalMatcher#matches}.
     *
     * @param goal       lowercased, trimmed goal text
     * @param firstToken first goal token, or null to skip that rule
     */
    List<GoalIndexEntry> findGoalMappings(String goal, String firstToken);

    /**
     * Identities of plugins whose description, summary, tags or capabilities contain the keyword
     * (case-insensitive).
     */
    Set<String> findPluginsMentioning(String keyword);

    /**
     * Overwrites the statistics of an indexed plugin.
     *
     * @return false when the plugin is not indexed
     */
    boolean updateStatistics(String pluginId, PluginStatistics statistics);

    /** Removes the plugin and its goal mappings. Returns false when it was not indexed. */
    boolean deletePlugin(String pluginId);
}
