package com.weft.chainer;

import com.weft.admission.AdmissionDecision;
import com.weft.admission.AdmissionGate;
import com.weft.admission.ExecutionErrorInfo;
import com.weft.admission.PluginBlockedException;
import com.weft.discovery.DiscoveryIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Single responsibility: run one chain node. Asks the admission gate first, calls the plugin with the
 * {@value #COMMAND} command, and records the outcome with admission, discovery and metrics whether the
 * call succeeded or not. Duration is measured around the plugin call only.
 */
public final class NodeInvoker {

    private static final Logger log = LoggerFactory.getLogger(NodeInvoker.class);

    public static final String COMMAND = "auto_chain";

    private final AdmissionGate admission;
    private final DiscoveryIndex discovery;
    private final ChainMetrics metrics;

    public NodeInvoker(AdmissionGate admission, DiscoveryIndex discovery, ChainMetrics metrics) {
        this.admission = Objects.requireNonNull(admission, "admission");
        this.discovery = Objects.requireNonNull(discovery, "discovery");
        this.metrics = metrics != null ? metrics : ChainMetrics.disabled();
    }

    /**
     * Invokes the node's plugin with the given inputs and marks the node executed on success.
     *
     * @param node   node to run
     * @param inputs the node's own copy of the context
     * @return plugin outputs (never null)
     * @throws PluginBlockedException if admission blocks the plugin; nothing is recorded in that case
     * @throws Exception              whatever the plugin throws
     */
    public Map<String, Object> invoke(ChainNode node, Map<String, Object> inputs) throws Exception {
        String pluginId = node.getPluginId();
        AdmissionDecision decision = admission.evaluate(pluginId);
        if (decision.isBlocked()) {
            throw new PluginBlockedException(decision);
        }
        node.begin(inputs);
        boolean success = false;
        Exception failure = null;
        long start = System.nanoTime();
        try {
            Map<String, Object> result = node.getPlugin().execute(COMMAND, inputs);
            Map<String, Object> outputs = result != null ? new LinkedHashMap<>(result) : new LinkedHashMap<>();
            node.complete(outputs);
            success = true;
            return outputs;
        } catch (Exception e) {
            failure = e;
            throw e;
        } finally {
            long durationNanos = System.nanoTime() - start;
            double seconds = durationNanos / 1_000_000_000.0;
            admission.recordExecution(pluginId, seconds, success, ExecutionErrorInfo.of(failure));
            discovery.recordOutcome(pluginId, success, seconds);
            metrics.recordNode(pluginId, success, durationNanos);
            log.debug("Node executed pluginId={} success={} durationMs={}", pluginId, success, durationNanos / 1_000_000);
        }
    }
}
