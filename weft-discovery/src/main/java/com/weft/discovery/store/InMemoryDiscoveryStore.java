package com.weft.discovery.store;

import com.weft.discovery.GoalIndexEntry;
import com.weft.discovery.IndexedPlugin;
import com.weft.discovery.PluginStatistics;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Discovery store kept in memory. Used when no database is configured and in tests.
 * Methods are synchronized; a replace is therefore atomic with respect to readers.
 */
public final class InMemoryDiscoveryStore implements DiscoveryStore {

    private final Map<String, IndexedPlugin> plugins = new TreeMap<>();
    private final Map<String, List<GoalIndexEntry>> mappings = new TreeMap<>();

    @Override
    public synchronized Optional<IndexedPlugin> findPlugin(String pluginId) {
        return Optional.ofNullable(plugins.get(pluginId));
    }

    @Override
    public synchronized List<IndexedPlugin> listPlugins() {
        return new ArrayList<>(plugins.values());
    }

    @Override
    public synchronized void replacePlugin(IndexedPlugin plugin, List<GoalIndexEntry> goals) {
        plugins.put(plugin.getPluginId(), plugin);
        mappings.put(plugin.getPluginId(), List.copyOf(goals));
    }

    @Override
    public synchronized List<GoalIndexEntry> goalMappings(String pluginId) {
        return mappings.getOrDefault(pluginId, List.of());
    }

    @Override
    public synchronized List<GoalIndexEntry> findGoalMappings(String goal, String firstToken) {
        List<GoalIndexEntry> out = new ArrayList<>();
        for (List<GoalIndexEntry> entries : mappings.values()) {
            for (GoalIndexEntry e : entries) {
                if (GoalMatcher.matches(e.getGoalPattern(), goal, firstToken)) {
                    out.add(e);
                }
            }
        }
        return out;
    }

    @Override
    public synchronized Set<String> findPluginsMentioning(String keyword) {
        Set<String> out = new TreeSet<>();
        for (IndexedPlugin p : plugins.values()) {
            if (GoalMatcher.mentions(p, keyword)) {
                out.add(p.getPluginId());
            }
        }
        return out;
    }

    @Override
    public synchronized boolean updateStatistics(String pluginId, PluginStatistics statistics) {
        IndexedPlugin p = plugins.get(pluginId);
        if (p == null) return false;
        plugins.put(pluginId, p.withStatistics(statistics));
        return true;
    }

    @Override
    public synchronized boolean deletePlugin(String pluginId) {
        mappings.remove(pluginId);
        return plugins.remove(pluginId) != null;
    }
}
