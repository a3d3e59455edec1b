package com.weft.admission;

import com.weft.plugin.PluginDescriptor;

/**
 * Produces confidence and risk for a plugin. Implementations live outside this module (source
 * scanners, manual review tables); the gate consumes the result once per (re)registration.
 */
@FunctionalInterface
public interface StaticAnalyzer {

    StaticAnalysis analyze(PluginDescriptor descriptor);
}
