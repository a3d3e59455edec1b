package com.weft.chainer.strategy;

import com.weft.chainer.ChainExecutionException;
import com.weft.chainer.ChainNode;
import com.weft.chainer.ChainResult;
import com.weft.chainer.ExecutionMode;
import com.weft.chainer.NodeInvoker;
import com.weft.chainer.PluginChain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Nodes in list order on the caller thread. Each node gets a copy of the context and its outputs are
 * merged before the next node starts. The first failure stops the chain.
 */
public final class SequentialStrategy implements ExecutionStrategy {

    private static final Logger log = LoggerFactory.getLogger(SequentialStrategy.class);

    @Override
    public ExecutionMode mode() {
        return ExecutionMode.SEQUENTIAL;
    }

    @Override
    public ChainResult run(PluginChain chain, Map<String, Object> context, NodeInvoker invoker) {
        List<String> executed = new ArrayList<>();
        for (ChainNode node : chain.getNodes()) {
            try {
                Map<String, Object> outputs = invoker.invoke(node, new LinkedHashMap<>(context));
                context.putAll(outputs);
                executed.add(node.getPluginId());
            } catch (Exception e) {
                log.error("Plugin failed chainId={} pluginId={}: {}", chain.getChainId(), node.getPluginId(), e.getMessage());
                return ChainResult.failed(chain.getChainId(), context, executed,
                        new ChainExecutionException(chain.getChainId(), node.getPluginId(), e));
            }
        }
        return ChainResult.succeeded(chain.getChainId(), context, executed);
    }
}
