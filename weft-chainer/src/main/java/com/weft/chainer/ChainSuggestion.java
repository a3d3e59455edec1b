package com.weft.chainer;

import java.util.List;

/**
 * Advisory chain for a user request; built but never executed by the chainer.
 *
 * @param chainId                  id of the registered trial chain
 * @param description              "Use &lt;category&gt; plugins to &lt;request&gt;"
 * @param pluginIds                node order of the trial chain
 * @param executionMode            mode of the trial chain
 * @param relevanceScore           0.1 per plugin in the category group
 * @param estimatedTimeSeconds     2 seconds per node
 */
public record ChainSuggestion(String chainId,
                              String description,
                              List<String> pluginIds,
                              ExecutionMode executionMode,
                              double relevanceScore,
                              int estimatedTimeSeconds) {

    public ChainSuggestion {
        pluginIds = pluginIds != null ? List.copyOf(pluginIds) : List.of();
    }
}
