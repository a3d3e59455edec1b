/**
 * Semantic discovery index: goal text to ranked plugin candidates, backed by a {@link com.weft.discovery.store.DiscoveryStore}.
 */
package com.weft.discovery;
