package com.weft.chainer;

import com.weft.plugin.ExecutablePlugin;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One scheduled plugin invocation. Dependencies name plugins that appear earlier in the same chain.
 * Inputs, outputs and the executed flag are written by {@link NodeInvoker} during a run.
 */
public final class ChainNode {

    private final String pluginId;
    private final ExecutablePlugin plugin;
    private final List<String> dependencies;
    private volatile Map<String, Object> inputs = Map.of();
    private volatile Map<String, Object> outputs = Map.of();
    private volatile boolean executed;

    ChainNode(String pluginId, ExecutablePlugin plugin, List<String> dependencies) {
        this.pluginId = Objects.requireNonNull(pluginId, "pluginId");
        this.plugin = Objects.requireNonNull(plugin, "plugin");
        this.dependencies = dependencies != null
                ? List.copyOf(new LinkedHashSet<>(dependencies))
                : List.of();
    }

    public String getPluginId() {
        return pluginId;
    }

    public ExecutablePlugin getPlugin() {
        return plugin;
    }

    public List<String> getDependencies() {
        return dependencies;
    }

    public boolean hasDependencies() {
        return !dependencies.isEmpty();
    }

    /** Inputs of the last invocation (read-only). */
    public Map<String, Object> getInputs() {
        return Collections.unmodifiableMap(inputs);
    }

    /** Outputs of the last successful invocation (read-only). */
    public Map<String, Object> getOutputs() {
        return Collections.unmodifiableMap(outputs);
    }

    public boolean isExecuted() {
        return executed;
    }

    void begin(Map<String, Object> nodeInputs) {
        this.inputs = nodeInputs;
        this.outputs = Map.of();
        this.executed = false;
    }

    void complete(Map<String, Object> nodeOutputs) {
        this.outputs = nodeOutputs;
        this.executed = true;
    }

    void reset() {
        this.inputs = Map.of();
        this.outputs = Map.of();
        this.executed = false;
    }

    @Override
    public String toString() {
        return "ChainNode{" + pluginId + ", deps=" + dependencies + ", executed=" + executed + "}";
    }
}
