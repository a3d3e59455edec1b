/**
 * Weft bootstrap: turns {@link com.weft.config.WeftConfig} into a running engine.
 * <ul>
 *   <li>{@link com.weft.bootstrap.WeftBootstrap} – loads providers and manifests, opens the discovery index, builds gate and chainer</li>
 *   <li>{@link com.weft.bootstrap.BootstrapContext} – the wired components</li>
 * </ul>
 */
package com.weft.bootstrap;
