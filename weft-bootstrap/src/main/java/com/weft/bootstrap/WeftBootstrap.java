package com.weft.bootstrap;

import com.weft.admission.AdmissionGate;
import com.weft.admission.StaticAnalyzer;
import com.weft.chainer.PluginChainer;
import com.weft.config.WeftConfig;
import com.weft.discovery.SemanticPluginDiscovery;
import com.weft.plugin.PluginDescriptor;
import com.weft.plugin.PluginManager;
import com.weft.plugin.PluginManifestLoader;
import com.weft.plugin.PluginRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Bootstrap for the engine: loads configuration, collects plugin providers from the classpath and
 * the plugins directory, applies descriptor manifests, indexes the registry for discovery, scores
 * plugins when a {@link StaticAnalyzer} is given and builds the chainer on top.
 * <p>
 * A manifest replaces the descriptor of the registered plugin with the same identity. Manifests for
 * identities no provider registered are logged and skipped: discovery must not return plugins the
 * chainer cannot execute.
 */
public final class WeftBootstrap {

    private static final Logger log = LoggerFactory.getLogger(WeftBootstrap.class);

    private WeftBootstrap() {
    }

    /** Bootstraps from environment variables, without static analysis. */
    public static BootstrapContext initialize() {
        log.info("Bootstrap: loading configuration from environment");
        return initialize(WeftConfig.fromEnvironment(), null);
    }

    /**
     * @param analyzer scores every registered plugin once; null leaves plugins unscored
     */
    public static BootstrapContext initialize(WeftConfig config, StaticAnalyzer analyzer) {
        Objects.requireNonNull(config, "WeftConfig");
        Path pluginsDir = Path.of(config.getPluginsDir());
        Path manifestDir = Path.of(config.getManifestDir());
        log.info("Bootstrap: pluginsDir={} manifestDir={} dbUrl={}",
                pluginsDir.toAbsolutePath(), manifestDir.toAbsolutePath(), config.getDbUrl());

        PluginManager pluginManager = new PluginManager();
        pluginManager.loadFromClasspath(WeftBootstrap.class.getClassLoader());
        pluginManager.loadFromDirectory(pluginsDir);
        PluginRegistry registry = new PluginRegistry();
        int registered = pluginManager.registerAll(registry);
        if (registered == 0) {
            log.warn("No plugins registered; check classpath providers and WEFT_PLUGINS_DIR for provider JARs");
        }
        applyManifests(registry, new PluginManifestLoader().loadDirectory(manifestDir));

        SemanticPluginDiscovery discovery = SemanticPluginDiscovery.open(config);
        discovery.indexRegistry(registry);

        AdmissionGate admission = new AdmissionGate(config);
        if (analyzer != null) {
            int scored = 0;
            for (PluginDescriptor descriptor : registry.descriptors()) {
                if (admission.score(descriptor, analyzer).isPresent()) scored++;
            }
            log.info("Bootstrap: scored {}/{} plugin(s)", scored, registry.size());
        }

        PluginChainer chainer = new PluginChainer(registry, discovery.getIndex(), admission, config);
        log.info("Bootstrap: ready plugins={}", registry.ids());
        return new BootstrapContext(config, registry, discovery, admission, chainer);
    }

    static List<String> applyManifests(PluginRegistry registry, List<PluginDescriptor> manifests) {
        List<String> applied = new ArrayList<>();
        for (PluginDescriptor descriptor : manifests) {
            if (registry.replaceDescriptor(descriptor)) {
                applied.add(descriptor.getIdentity());
            } else {
                log.warn("Manifest for unregistered plugin skipped pluginId={}", descriptor.getIdentity());
            }
        }
        if (!applied.isEmpty()) {
            log.info("Bootstrap: manifests applied to {}", applied);
        }
        return applied;
    }
}
