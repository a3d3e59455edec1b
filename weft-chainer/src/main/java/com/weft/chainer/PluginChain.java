package com.weft.chainer;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Execution plan for one goal: ordered nodes, execution mode, metadata and the initial data given at
 * build time. A chain runs at most once at a time; see {@link PluginChainer#runChain}.
 */
public final class PluginChain {

    /** Metadata key: goal text. */
    public static final String META_GOAL = "goal";
    public static final String META_CREATED_BY = "createdBy";
    public static final String META_CREATED_AT = "createdAt";
    public static final String META_PLUGIN_COUNT = "pluginCount";
    /** Metadata key: plugin id → warning message, for plugins admitted with a warning. */
    public static final String META_WARNINGS = "warnings";
    /**
     * Metadata key: plugin id → {@link com.weft.admission.AdmissionDecision} for plugins the admission
     * gate blocked at build time, carrying risk, confidence, message and ranked alternatives.
     */
    public static final String META_BLOCKED = "blocked";
    /** Metadata key: ids of admitted plugins the greedy build could not reach. */
    public static final String META_DROPPED = "dropped";

    private final String chainId;
    private final List<ChainNode> nodes;
    private final ExecutionMode executionMode;
    private final Map<String, Object> metadata;
    private final Map<String, Object> initialData;
    private final Instant createdAt;
    private final AtomicBoolean running = new AtomicBoolean(false);

    PluginChain(String chainId, List<ChainNode> nodes, ExecutionMode executionMode,
                Map<String, Object> metadata, Map<String, Object> initialData, Instant createdAt) {
        this.chainId = Objects.requireNonNull(chainId, "chainId");
        this.nodes = List.copyOf(nodes);
        this.executionMode = executionMode != null ? executionMode : ExecutionMode.ADAPTIVE;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.initialData = initialData != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(initialData))
                : Map.of();
        this.createdAt = createdAt != null ? createdAt : Instant.now();
    }

    public String getChainId() {
        return chainId;
    }

    public List<ChainNode> getNodes() {
        return nodes;
    }

    public List<String> getPluginIds() {
        return nodes.stream().map(ChainNode::getPluginId).toList();
    }

    public ExecutionMode getExecutionMode() {
        return executionMode;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public Map<String, Object> getInitialData() {
        return initialData;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public boolean isRunning() {
        return running.get();
    }

    public int getExecutedCount() {
        int n = 0;
        for (ChainNode node : nodes) {
            if (node.isExecuted()) n++;
        }
        return n;
    }

    boolean tryClaim() {
        return running.compareAndSet(false, true);
    }

    void release() {
        running.set(false);
    }

    @Override
    public String toString() {
        return "PluginChain{" + chainId + ", mode=" + executionMode + ", plugins=" + getPluginIds() + "}";
    }
}
