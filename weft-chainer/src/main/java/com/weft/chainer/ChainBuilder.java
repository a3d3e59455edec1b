package com.weft.chainer;

import com.weft.plugin.PluginDescriptor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Greedy first-fit ordering of ranked candidates by declared input/output types.
 * <p>
 * The seed is the highest-priority candidate that declares no inputs or is auto-chain eligible
 * (earlier rank wins ties). After that each pass adds the first remaining candidate, in rank order,
 * that declares no inputs or consumes a type some added plugin produces. Building stops when a pass
 * adds nothing; candidates left over are reported as dropped. There is no backtracking.
 */
final class ChainBuilder {

    private ChainBuilder() {
    }

    static Plan plan(List<PluginDescriptor> ranked) {
        List<PluginDescriptor> ordered = new ArrayList<>();
        Set<String> availableOutputs = new HashSet<>();

        PluginDescriptor seed = null;
        for (PluginDescriptor d : ranked) {
            if (d.getDeclaredInputTypes().isEmpty() || d.isAutoChainEligible()) {
                if (seed == null || d.getChainPriority() > seed.getChainPriority()) {
                    seed = d;
                }
            }
        }
        if (seed != null) {
            ordered.add(seed);
            availableOutputs.addAll(seed.getDeclaredOutputTypes());
        }

        List<PluginDescriptor> remaining = new ArrayList<>(ranked);
        remaining.removeAll(ordered);
        boolean added = seed != null;
        while (added && !remaining.isEmpty()) {
            added = false;
            for (PluginDescriptor d : remaining) {
                if (d.getDeclaredInputTypes().isEmpty() || !Collections.disjoint(d.getDeclaredInputTypes(), availableOutputs)) {
                    ordered.add(d);
                    availableOutputs.addAll(d.getDeclaredOutputTypes());
                    remaining.remove(d);
                    added = true;
                    break;
                }
            }
        }
        List<String> dropped = remaining.stream().map(PluginDescriptor::getIdentity).toList();
        return new Plan(ordered, dropped);
    }

    /**
     * Identities of the earlier plugins whose declared outputs intersect the plugin's declared inputs,
     * in chain order.
     */
    static List<String> dependencies(PluginDescriptor descriptor, List<PluginDescriptor> earlier) {
        Set<String> deps = new LinkedHashSet<>();
        for (PluginDescriptor e : earlier) {
            if (!Collections.disjoint(e.getDeclaredOutputTypes(), descriptor.getDeclaredInputTypes())) {
                deps.add(e.getIdentity());
            }
        }
        return new ArrayList<>(deps);
    }

    record Plan(List<PluginDescriptor> ordered, List<String> dropped) {
    }
}
