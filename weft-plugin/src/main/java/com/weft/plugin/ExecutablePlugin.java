package com.weft.plugin;

import java.util.Map;

/**
 * Base contract for all plugins: execute a command with an input map, return an output map.
 * The chainer treats implementations as opaque; it only looks them up by identity in
 * {@link PluginRegistry}.
 * <p>
 * <b>Threading and state:</b> one instance is registered per plugin identity and may be invoked
 * from several chains at once, and from several threads when a chain runs a dependency level in
 * parallel. Implement as thread-safe if using mutable state.
 */
@FunctionalInterface
public interface ExecutablePlugin {

    /**
     * Executes the plugin.
     *
     * @param command command name (the chainer passes {@code auto_chain})
     * @param input   map of input keys to values; never null
     * @return map of output keys to values; null is treated as empty
     * @throws Exception on execution failure
     */
    Map<String, Object> execute(String command, Map<String, Object> input) throws Exception;
}
