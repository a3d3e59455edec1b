package com.weft.bootstrap;

import com.weft.plugin.ExecutablePlugin;
import com.weft.plugin.PluginDescriptor;
import com.weft.plugin.PluginProvider;

import java.util.Map;

/** Test provider registered through META-INF/services. */
public class CsvLoaderPluginProvider implements PluginProvider {

    private final PluginDescriptor descriptor = PluginDescriptor.builder("csv-loader")
            .description("Loads CSV exports")
            .category("data")
            .outputTypes("rows")
            .build();

    private final ExecutablePlugin plugin = (command, input) -> Map.of("rows", 3);

    @Override
    public PluginDescriptor getDescriptor() {
        return descriptor;
    }

    @Override
    public ExecutablePlugin getPlugin() {
        return plugin;
    }
}
