package com.weft.chainer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one chain run. On failure the context holds everything committed before the failing node
 * (sequential) or before the failing level (parallel).
 */
public final class ChainResult {

    private final String chainId;
    private final Map<String, Object> context;
    private final List<String> executedPluginIds;
    private final ChainExecutionException error;

    private ChainResult(String chainId, Map<String, Object> context, List<String> executedPluginIds,
                        ChainExecutionException error) {
        this.chainId = chainId;
        this.context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
        this.executedPluginIds = List.copyOf(executedPluginIds);
        this.error = error;
    }

    public static ChainResult succeeded(String chainId, Map<String, Object> context, List<String> executedPluginIds) {
        return new ChainResult(chainId, context, executedPluginIds, null);
    }

    public static ChainResult failed(String chainId, Map<String, Object> context, List<String> executedPluginIds,
                                     ChainExecutionException error) {
        return new ChainResult(chainId, context, executedPluginIds, Objects.requireNonNull(error, "error"));
    }

    public String getChainId() {
        return chainId;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    /** Plugins whose outputs were merged into the context, in merge order. */
    public List<String> getExecutedPluginIds() {
        return executedPluginIds;
    }

    public boolean isSuccess() {
        return error == null;
    }

    public Optional<ChainExecutionException> getError() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return "ChainResult{" + chainId + ", success=" + isSuccess() + ", executed=" + executedPluginIds + "}";
    }
}
