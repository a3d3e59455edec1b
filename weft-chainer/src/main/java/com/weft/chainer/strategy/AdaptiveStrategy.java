package com.weft.chainer.strategy;

import com.weft.chainer.ChainNode;
import com.weft.chainer.ChainResult;
import com.weft.chainer.ExecutionMode;
import com.weft.chainer.NodeInvoker;
import com.weft.chainer.PluginChain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * Parallel when any node has dependencies, sequential otherwise.
 */
public final class AdaptiveStrategy implements ExecutionStrategy {

    private static final Logger log = LoggerFactory.getLogger(AdaptiveStrategy.class);

    private final ExecutionStrategy sequential;
    private final ExecutionStrategy parallel;

    public AdaptiveStrategy(ExecutionStrategy sequential, ExecutionStrategy parallel) {
        this.sequential = Objects.requireNonNull(sequential, "sequential");
        this.parallel = Objects.requireNonNull(parallel, "parallel");
    }

    @Override
    public ExecutionMode mode() {
        return ExecutionMode.ADAPTIVE;
    }

    @Override
    public ChainResult run(PluginChain chain, Map<String, Object> context, NodeInvoker invoker) {
        ExecutionStrategy delegate = select(chain);
        log.debug("Adaptive run chainId={} delegate={}", chain.getChainId(), delegate.mode());
        return delegate.run(chain, context, invoker);
    }

    ExecutionStrategy select(PluginChain chain) {
        for (ChainNode node : chain.getNodes()) {
            if (node.hasDependencies()) {
                return parallel;
            }
        }
        return sequential;
    }
}
