package com.weft.discovery;

import com.weft.plugin.PluginDescriptor;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Goal → ranked plugin candidates. Advisory: store failures are logged and surface as empty results,
 * never as exceptions. Only null or blank identities and null descriptors are rejected.
 */
public interface DiscoveryIndex {

    /**
     * Indexes (or re-indexes) a plugin. Re-indexing replaces the plugin's goal mappings and keeps its
     * outcome statistics; an unchanged descriptor is a no-op.
     *
     * @return true when the plugin is indexed after the call
     */
    boolean index(PluginDescriptor descriptor);

    /** Indexes every descriptor; returns how many are indexed afterwards. */
    default int indexAll(Collection<PluginDescriptor> descriptors) {
        int n = 0;
        for (PluginDescriptor d : descriptors) {
            if (index(d)) n++;
        }
        return n;
    }

    /**
     * Ranked candidates for a goal. Blank goal or {@code limit <= 0} returns an empty list.
     */
    List<DiscoveryCandidate> query(String goalText, int limit);

    /**
     * Folds one execution outcome into the plugin's statistics. Unknown plugin is a no-op.
     */
    void recordOutcome(String pluginId, boolean success, double executionTimeSeconds);

    Optional<IndexedPlugin> find(String pluginId);

    /** Removes a plugin from the index; false when it was not indexed. */
    boolean remove(String pluginId);
}
