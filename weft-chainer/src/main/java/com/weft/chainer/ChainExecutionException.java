package com.weft.chainer;

/**
 * A chain node failed. Carries the chain and the failing plugin; the cause is the plugin's exception,
 * or a {@link com.weft.admission.PluginBlockedException} when admission vetoed the node at run time.
 */
public class ChainExecutionException extends RuntimeException {

    private final String chainId;
    private final String pluginId;

    public ChainExecutionException(String chainId, String pluginId, Throwable cause) {
        super("Plugin " + pluginId + " failed in chain " + chainId
                + (cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : ""), cause);
        this.chainId = chainId;
        this.pluginId = pluginId;
    }

    public String getChainId() {
        return chainId;
    }

    public String getPluginId() {
        return pluginId;
    }
}
