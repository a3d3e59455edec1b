package com.weft.plugin;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of live plugins by identity. The chainer resolves each chain node's plugin through
 * this registry; discovery and admission only see identities.
 */
public final class PluginRegistry {

    /** identity → PluginEntry */
    private final Map<String, PluginEntry> plugins = new ConcurrentHashMap<>();

    /**
     * Registers a plugin under its descriptor identity.
     *
     * @param descriptor static metadata (identity, input/output types, ...)
     * @param plugin     implementation
     * @throws IllegalArgumentException if a plugin is already registered under the same identity
     */
    public void register(PluginDescriptor descriptor, ExecutablePlugin plugin) {
        Objects.requireNonNull(descriptor, "descriptor");
        Objects.requireNonNull(plugin, "plugin");
        PluginEntry entry = new PluginEntry(descriptor, plugin);
        if (plugins.putIfAbsent(descriptor.getIdentity(), entry) != null) {
            throw new IllegalArgumentException("Plugin already registered: " + descriptor.getIdentity());
        }
    }

    /** Registers the provider's descriptor and plugin instance. */
    public void register(PluginProvider provider) {
        Objects.requireNonNull(provider, "provider");
        register(provider.getDescriptor(), provider.getPlugin());
    }

    /**
     * Swaps the descriptor of an already registered plugin, keeping its instance.
     *
     * @return false when no plugin is registered under the descriptor's identity
     */
    public boolean replaceDescriptor(PluginDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        return plugins.computeIfPresent(descriptor.getIdentity(),
                (id, entry) -> new PluginEntry(descriptor, entry.getPlugin())) != null;
    }

    /**
     * Returns the entry for the given identity, or null if not registered.
     */
    public PluginEntry get(String pluginId) {
        if (pluginId == null || pluginId.isBlank()) return null;
        return plugins.get(pluginId.trim());
    }

    /** Returns the plugin instance for invocation, or null if not registered. */
    public ExecutablePlugin getExecutable(String pluginId) {
        PluginEntry e = get(pluginId);
        return e != null ? e.getPlugin() : null;
    }

    /** Returns the descriptor, or null if not registered. */
    public PluginDescriptor getDescriptor(String pluginId) {
        PluginEntry e = get(pluginId);
        return e != null ? e.getDescriptor() : null;
    }

    public boolean contains(String pluginId) {
        return get(pluginId) != null;
    }

    /** Registered identities, sorted. */
    public List<String> ids() {
        List<String> out = new ArrayList<>(plugins.keySet());
        Collections.sort(out);
        return out;
    }

    /** Descriptors of all registered plugins (unordered snapshot). */
    public Collection<PluginDescriptor> descriptors() {
        List<PluginDescriptor> out = new ArrayList<>(plugins.size());
        for (PluginEntry e : plugins.values()) {
            out.add(e.getDescriptor());
        }
        return out;
    }

    /** Removes a registration. Returns true when something was removed. */
    public boolean unregister(String pluginId) {
        if (pluginId == null || pluginId.isBlank()) return false;
        return plugins.remove(pluginId.trim()) != null;
    }

    public int size() {
        return plugins.size();
    }

    /** Removes all registrations (mainly for tests). */
    public void clear() {
        plugins.clear();
    }

    /** Registered plugin: descriptor and live instance. */
    public static final class PluginEntry {
        private final PluginDescriptor descriptor;
        private final ExecutablePlugin plugin;

        PluginEntry(PluginDescriptor descriptor, ExecutablePlugin plugin) {
            this.descriptor = descriptor;
            this.plugin = plugin;
        }

        public String getId() {
            return descriptor.getIdentity();
        }

        public PluginDescriptor getDescriptor() {
            return descriptor;
        }

        public ExecutablePlugin getPlugin() {
            return plugin;
        }
    }
}
