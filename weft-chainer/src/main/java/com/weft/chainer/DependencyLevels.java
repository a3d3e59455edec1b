package com.weft.chainer;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups chain nodes into dependency levels: level 0 for a node without dependencies, otherwise one more
 * than the highest level among its dependencies. Dependencies that are not in the chain are ignored.
 */
public final class DependencyLevels {

    private DependencyLevels() {
    }

    /**
     * Levels in ascending order; nodes keep chain order within a level.
     */
    public static List<List<ChainNode>> of(List<ChainNode> nodes) {
        Map<String, Integer> levelById = new HashMap<>();
        List<List<ChainNode>> levels = new ArrayList<>();
        for (ChainNode node : nodes) {
            int level = 0;
            for (String dep : node.getDependencies()) {
                Integer depLevel = levelById.get(dep);
                if (depLevel != null) {
                    level = Math.max(level, depLevel + 1);
                }
            }
            levelById.put(node.getPluginId(), level);
            while (levels.size() <= level) {
                levels.add(new ArrayList<>());
            }
            levels.get(level).add(node);
        }
        return levels;
    }
}
