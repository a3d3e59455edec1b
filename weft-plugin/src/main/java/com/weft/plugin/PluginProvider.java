package com.weft.plugin;

/**
 * SPI for pluggable plugins. Implementations are discovered via {@link java.util.ServiceLoader}
 * (META-INF/services/com.weft.plugin.PluginProvider), either from the application classpath or
 * from JARs in the plugins directory (see {@link PluginManager}).
 */
public interface PluginProvider {

    /**
     * Static metadata: identity, description, category, tags and declared input/output
     * capability types. The identity is the registry key and the discovery index key.
     */
    PluginDescriptor getDescriptor();

    /**
     * Plugin instance. Typically created once in the provider constructor.
     */
    ExecutablePlugin getPlugin();

    /**
     * Whether this provider should be registered. Override to skip registration when a required
     * environment setting is missing.
     */
    default boolean isEnabled() {
        return true;
    }
}
