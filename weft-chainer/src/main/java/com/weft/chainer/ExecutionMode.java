package com.weft.chainer;

/**
 * How {@link PluginChainer#runChain} schedules a chain's nodes.
 */
public enum ExecutionMode {
    /** Nodes run one after another in list order. */
    SEQUENTIAL,
    /** Nodes run level by level; every node of a level runs concurrently. */
    PARALLEL,
    /** PARALLEL when any node has dependencies, SEQUENTIAL otherwise. */
    ADAPTIVE
}
