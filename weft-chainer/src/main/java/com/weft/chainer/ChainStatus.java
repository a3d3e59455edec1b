package com.weft.chainer;

import java.util.Map;

/**
 * Progress snapshot of a registered chain. {@code progress} is executed / total, or 0 for an empty chain.
 */
public record ChainStatus(String chainId,
                          int totalPlugins,
                          int executedPlugins,
                          double progress,
                          ExecutionMode executionMode,
                          boolean running,
                          Map<String, Object> metadata) {

    static ChainStatus of(PluginChain chain) {
        int total = chain.getNodes().size();
        int executed = chain.getExecutedCount();
        double progress = total > 0 ? (double) executed / total : 0.0;
        return new ChainStatus(chain.getChainId(), total, executed, progress,
                chain.getExecutionMode(), chain.isRunning(), chain.getMetadata());
    }
}
