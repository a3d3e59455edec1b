package com.weft.chainer.strategy;

import com.weft.chainer.ChainResult;
import com.weft.chainer.ExecutionMode;
import com.weft.chainer.NodeInvoker;
import com.weft.chainer.PluginChain;

import java.util.Map;

/**
 * Runs a chain's nodes under one {@link ExecutionMode}. Node failures are returned in the
 * {@link ChainResult}, never thrown.
 */
public interface ExecutionStrategy {

    ExecutionMode mode();

    /**
     * @param chain   chain to run; the caller holds its run claim
     * @param context initial context; owned by this run and mutated as nodes commit
     * @param invoker runs a single node
     */
    ChainResult run(PluginChain chain, Map<String, Object> context, NodeInvoker invoker);
}
