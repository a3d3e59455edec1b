package com.weft.chainer;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters for chain execution. A disabled instance records nothing.
 */
public final class ChainMetrics {

    public static final String PLUGIN_EXECUTION_TIMER = "weft.plugin.execution";
    public static final String NODE_EXECUTIONS_COUNTER = "weft.node.executions";
    public static final String CHAIN_RUNS_COUNTER = "weft.chain.runs";

    private final MeterRegistry registry;

    public ChainMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public static ChainMetrics disabled() {
        return new ChainMetrics(null);
    }

    /** Null when disabled. */
    public MeterRegistry getRegistry() {
        return registry;
    }

    public boolean isEnabled() {
        return registry != null;
    }

    void recordNode(String pluginId, boolean success, long durationNanos) {
        if (registry == null) return;
        String id = pluginId != null && !pluginId.isBlank() ? pluginId : "unknown";
        registry.counter(NODE_EXECUTIONS_COUNTER, "success", String.valueOf(success)).increment();
        Timer.builder(PLUGIN_EXECUTION_TIMER)
                .tag("pluginId", id)
                .tag("success", String.valueOf(success))
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    void recordChain(ExecutionMode mode, boolean success) {
        if (registry == null) return;
        registry.counter(CHAIN_RUNS_COUNTER,
                "mode", mode.name(),
                "success", String.valueOf(success)
        ).increment();
    }
}
