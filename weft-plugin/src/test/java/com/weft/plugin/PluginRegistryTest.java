package com.weft.plugin;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PluginRegistryTest {

    private static final ExecutablePlugin NOOP = (command, input) -> Map.of();

    @Test
    void register_thenLookupByIdentity() {
        PluginRegistry registry = new PluginRegistry();
        PluginDescriptor d = PluginDescriptor.builder("parser").outputTypes("ast").build();
        registry.register(d, NOOP);

        assertTrue(registry.contains("parser"));
        assertSame(NOOP, registry.getExecutable("parser"));
        assertSame(d, registry.getDescriptor(" parser "));
        assertEquals("parser", registry.get("parser").getId());
    }

    @Test
    void register_rejectsDuplicateIdentity() {
        PluginRegistry registry = new PluginRegistry();
        registry.register(PluginDescriptor.builder("a").build(), NOOP);

        assertThrows(IllegalArgumentException.class,
                () -> registry.register(PluginDescriptor.builder("a").description("other").build(), NOOP));
        assertEquals(1, registry.size());
    }

    @Test
    void unknownOrBlankIdentity_returnsNull() {
        PluginRegistry registry = new PluginRegistry();
        assertNull(registry.get("missing"));
        assertNull(registry.get(" "));
        assertNull(registry.getExecutable(null));
        assertFalse(registry.unregister("missing"));
    }

    @Test
    void ids_areSortedAndUnregisterRemoves() {
        PluginRegistry registry = new PluginRegistry();
        registry.register(PluginDescriptor.builder("zeta").build(), NOOP);
        registry.register(PluginDescriptor.builder("alpha").build(), NOOP);

        assertEquals(List.of("alpha", "zeta"), registry.ids());
        assertTrue(registry.unregister("zeta"));
        assertEquals(List.of("alpha"), registry.ids());
        assertEquals(1, registry.descriptors().size());
    }

    @Test
    void descriptor_blankIdentityRejected() {
        assertThrows(IllegalArgumentException.class, () -> PluginDescriptor.builder("  ").build());
        assertThrows(NullPointerException.class, () -> PluginDescriptor.builder(null).build());
    }

    @Test
    void descriptor_defaultsApplied() {
        PluginDescriptor d = PluginDescriptor.builder(" tool ").build();
        assertEquals("tool", d.getIdentity());
        assertEquals(PluginDescriptor.DEFAULT_CATEGORY, d.getCategory());
        assertEquals(PluginDescriptor.DEFAULT_VERSION, d.getVersion());
        assertTrue(d.getDeclaredInputTypes().isEmpty());
        assertFalse(d.isAutoChainEligible());
        assertNotNull(d.toString());
    }

    @Test
    void replaceDescriptor_keepsInstanceAndIgnoresUnknownIdentity() {
        PluginRegistry registry = new PluginRegistry();
        registry.register(PluginDescriptor.builder("csv").description("Reads CSV").build(), NOOP);
        PluginDescriptor richer = PluginDescriptor.builder("csv").description("Process data files").tags("tabular").build();

        assertTrue(registry.replaceDescriptor(richer));
        assertSame(richer, registry.getDescriptor("csv"));
        assertSame(NOOP, registry.getExecutable("csv"));
        assertFalse(registry.replaceDescriptor(PluginDescriptor.builder("ghost").build()));
        assertFalse(registry.contains("ghost"));
    }
}
