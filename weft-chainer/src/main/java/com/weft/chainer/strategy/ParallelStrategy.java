package com.weft.chainer.strategy;

import com.weft.chainer.ChainExecutionException;
import com.weft.chainer.ChainNode;
import com.weft.chainer.ChainResult;
import com.weft.chainer.DependencyLevels;
import com.weft.chainer.ExecutionMode;
import com.weft.chainer.NodeInvoker;
import com.weft.chainer.PluginChain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

/**
 * Level by level (see {@link DependencyLevels}). Every node of a level is submitted to the executor with
 * its own copy of the context, then all of them are joined. Outputs are merged in chain order only when
 * the whole level succeeded; otherwise the chain stops with the context of the last complete level.
 */
public final class ParallelStrategy implements ExecutionStrategy {

    private static final Logger log = LoggerFactory.getLogger(ParallelStrategy.class);

    private final ExecutorService executor;

    public ParallelStrategy(ExecutorService executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public ExecutionMode mode() {
        return ExecutionMode.PARALLEL;
    }

    @Override
    public ChainResult run(PluginChain chain, Map<String, Object> context, NodeInvoker invoker) {
        String chainId = chain.getChainId();
        List<String> executed = new ArrayList<>();
        List<List<ChainNode>> levels = DependencyLevels.of(chain.getNodes());
        for (int level = 0; level < levels.size(); level++) {
            List<ChainNode> nodes = levels.get(level);
            List<Future<Map<String, Object>>> futures = new ArrayList<>(nodes.size());
            ChainExecutionException failure = null;
            for (ChainNode node : nodes) {
                Map<String, Object> inputs = new LinkedHashMap<>(context);
                try {
                    futures.add(executor.submit(() -> invoker.invoke(node, inputs)));
                } catch (RejectedExecutionException e) {
                    failure = new ChainExecutionException(chainId, node.getPluginId(), e);
                    break;
                }
            }
            List<Map<String, Object>> outputs = new ArrayList<>(futures.size());
            for (int i = 0; i < futures.size(); i++) {
                ChainNode node = nodes.get(i);
                try {
                    outputs.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    log.error("Plugin failed chainId={} level={} pluginId={}: {}",
                            chainId, level, node.getPluginId(), cause.getMessage());
                    if (failure == null) {
                        failure = new ChainExecutionException(chainId, node.getPluginId(), cause);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    for (Future<?> f : futures) {
                        f.cancel(true);
                    }
                    if (failure == null) {
                        failure = new ChainExecutionException(chainId, node.getPluginId(), e);
                    }
                    break;
                }
            }
            if (failure != null) {
                log.warn("Level aborted chainId={} level={} nodes={}; keeping context of previous levels",
                        chainId, level, nodes.size());
                return ChainResult.failed(chainId, context, executed, failure);
            }
            for (int i = 0; i < nodes.size(); i++) {
                context.putAll(outputs.get(i));
                executed.add(nodes.get(i).getPluginId());
            }
            log.debug("Level committed chainId={} level={} nodes={}", chainId, level, nodes.size());
        }
        return ChainResult.succeeded(chainId, context, executed);
    }
}
