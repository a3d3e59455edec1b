/**
 * Weft chainer and scheduler: builds plugin chains for a goal and runs them.
 * <ul>
 *   <li>{@link com.weft.chainer.PluginChainer} – build, run, suggest, status and cleanup of chains</li>
 *   <li>{@link com.weft.chainer.PluginChain} / {@link com.weft.chainer.ChainNode} – the plan and its nodes</li>
 *   <li>{@link com.weft.chainer.DependencyLevels} – dependency levels for parallel runs</li>
 *   <li>{@link com.weft.chainer.NodeInvoker} – admission check, plugin call and outcome recording for one node</li>
 *   <li>{@link com.weft.chainer.strategy} – sequential, parallel and adaptive execution</li>
 * </ul>
 */
package com.weft.chainer;
