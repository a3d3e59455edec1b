/**
 * Weft plugin contract and registry. Plugins are opaque capability providers looked up by identity.
 * <ul>
 *   <li>{@link com.weft.plugin.ExecutablePlugin} – base contract: execute(command, input) → output map</li>
 *   <li>{@link com.weft.plugin.PluginDescriptor} – identity, description, tags and declared input/output capability types</li>
 *   <li>{@link com.weft.plugin.PluginProvider} – SPI for pluggable discovery (ServiceLoader)</li>
 *   <li>{@link com.weft.plugin.PluginManager} – internal registration, classpath and directory loading</li>
 *   <li>{@link com.weft.plugin.PluginManifestLoader} – JSON descriptor manifests</li>
 *   <li>{@link com.weft.plugin.PluginRegistry} – identity-keyed registration and lookup</li>
 * </ul>
 */
package com.weft.plugin;
