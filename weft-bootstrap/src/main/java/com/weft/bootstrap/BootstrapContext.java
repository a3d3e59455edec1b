package com.weft.bootstrap;

import com.weft.admission.AdmissionGate;
import com.weft.chainer.PluginChainer;
import com.weft.config.WeftConfig;
import com.weft.discovery.SemanticPluginDiscovery;
import com.weft.plugin.PluginRegistry;

/**
 * Everything {@link WeftBootstrap} wired together. Closing it closes the chainer and its worker pool.
 */
public final class BootstrapContext implements AutoCloseable {

    private final WeftConfig config;
    private final PluginRegistry registry;
    private final SemanticPluginDiscovery discovery;
    private final AdmissionGate admission;
    private final PluginChainer chainer;

    BootstrapContext(WeftConfig config, PluginRegistry registry, SemanticPluginDiscovery discovery,
                     AdmissionGate admission, PluginChainer chainer) {
        this.config = config;
        this.registry = registry;
        this.discovery = discovery;
        this.admission = admission;
        this.chainer = chainer;
    }

    public WeftConfig getConfig() {
        return config;
    }

    public PluginRegistry getRegistry() {
        return registry;
    }

    public SemanticPluginDiscovery getDiscovery() {
        return discovery;
    }

    public AdmissionGate getAdmission() {
        return admission;
    }

    public PluginChainer getChainer() {
        return chainer;
    }

    @Override
    public void close() {
        chainer.close();
    }
}
