package com.weft.plugin;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

/**
 * Collects plugin providers from three places: explicit registration, the application
 * classpath ({@link ServiceLoader}) and provider JARs in a configured directory. Providers are
 * then registered into a {@link PluginRegistry} with {@link #registerAll(PluginRegistry)}.
 * <p>
 * Load failures for JAR providers are logged and skipped; the engine keeps running with the
 * providers it could load.
 */
public final class PluginManager {

    private static final Logger log = LoggerFactory.getLogger(PluginManager.class);

    private final List<PluginProvider> internalProviders = new ArrayList<>();
    private final List<PluginProvider> externalProviders = new ArrayList<>();
    @SuppressWarnings("unused") // keep references so classloaders are not GC'd
    private final List<ClassLoader> externalLoaders = new ArrayList<>();

    /**
     * Registers an internal provider (on the application classpath).
     */
    public void registerInternal(PluginProvider provider) {
        if (provider != null) {
            internalProviders.add(provider);
        }
    }

    /**
     * Adds every {@link PluginProvider} visible through {@link ServiceLoader} on the given class loader.
     *
     * @return number of providers found
     */
    public int loadFromClasspath(ClassLoader classLoader) {
        ClassLoader cl = classLoader != null ? classLoader : PluginManager.class.getClassLoader();
        int n = 0;
        for (PluginProvider provider : ServiceLoader.load(PluginProvider.class, cl)) {
            internalProviders.add(provider);
            n++;
        }
        log.info("Loaded {} provider(s) from classpath", n);
        return n;
    }

    /**
     * Loads provider JARs from the given directory. Only {@code *.jar} files directly inside the
     * directory are considered.
     *
     * @param pluginsDir path to the plugins directory
     */
    public void loadFromDirectory(Path pluginsDir) {
        if (pluginsDir == null) {
            return;
        }
        if (!Files.exists(pluginsDir)) {
            log.debug("Plugins directory does not exist: {}", pluginsDir);
            return;
        }
        if (!Files.isDirectory(pluginsDir)) {
            log.warn("Plugins path is not a directory: {}", pluginsDir);
            return;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(pluginsDir, "*.jar")) {
            for (Path jar : stream) {
                loadJar(jar);
            }
        } catch (IOException e) {
            log.warn("Failed to list plugins directory {}: {}", pluginsDir, e.getMessage());
        }
    }

    /**
     * Loads one JAR. On any failure (classloader, ServiceLoader, provider constructor), logs at
     * error level and skips this JAR.
     */
    private void loadJar(Path jar) {
        try {
            URL jarUrl = jar.toUri().toURL();
            URLClassLoader loader = new URLClassLoader(new URL[]{jarUrl}, PluginProvider.class.getClassLoader());
            externalLoaders.add(loader);
            int n = 0;
            for (PluginProvider provider : ServiceLoader.load(PluginProvider.class, loader)) {
                externalProviders.add(provider);
                n++;
            }
            if (n > 0) {
                log.info("Loaded {} provider(s) from JAR: {}", n, jar.getFileName());
            }
        } catch (Exception | ServiceConfigurationError e) {
            log.error("Failed to load plugin JAR {} (skipping): {}", jar, e.getMessage(), e);
        }
    }

    /**
     * Registers every enabled provider: internal first, then external. A duplicate identity among
     * internal providers is fatal; among external providers it is logged and skipped.
     *
     * @return number of providers registered
     */
    public int registerAll(PluginRegistry registry) {
        int registered = 0;
        for (PluginProvider provider : internalProviders) {
            if (!provider.isEnabled()) {
                log.info("Plugin provider disabled, skipping: {}", provider.getClass().getName());
                continue;
            }
            registry.register(provider);
            registered++;
        }
        for (PluginProvider provider : externalProviders) {
            if (!provider.isEnabled()) {
                continue;
            }
            try {
                registry.register(provider);
                registered++;
            } catch (RuntimeException e) {
                log.error("External plugin {} failed to register (skipping): {}",
                        provider.getClass().getName(), e.getMessage(), e);
            }
        }
        log.info("Registered {} plugin(s) ({} internal, {} external provider(s) seen)",
                registered, internalProviders.size(), externalProviders.size());
        return registered;
    }

    /** Returns all providers: internal first, then external. */
    public List<PluginProvider> getProviders() {
        List<PluginProvider> out = new ArrayList<>(internalProviders.size() + externalProviders.size());
        out.addAll(internalProviders);
        out.addAll(externalProviders);
        return out;
    }

    public int getInternalCount() {
        return internalProviders.size();
    }

    public int getExternalCount() {
        return externalProviders.size();
    }
}
