package com.weft.plugin;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PluginManagerTest {

    @TempDir
    Path tempDir;

    @Test
    void loadFromClasspath_findsServiceLoaderProvider() throws Exception {
        PluginManager manager = new PluginManager();
        int found = manager.loadFromClasspath(getClass().getClassLoader());
        PluginRegistry registry = new PluginRegistry();
        manager.registerAll(registry);

        assertTrue(found >= 1);
        assertTrue(registry.contains("echo"));
        Map<String, Object> out = registry.getExecutable("echo").execute("auto_chain", Map.of("x", 1));
        assertEquals("auto_chain", out.get("command"));
        assertEquals(1, out.get("x"));
    }

    @Test
    void registerAll_skipsDisabledProviders() {
        PluginManager manager = new PluginManager();
        manager.registerInternal(new EchoPluginProvider() {
            @Override
            public boolean isEnabled() {
                return false;
            }
        });
        PluginRegistry registry = new PluginRegistry();

        assertEquals(0, manager.registerAll(registry));
        assertFalse(registry.contains("echo"));
        assertEquals(1, manager.getInternalCount());
    }

    @Test
    void loadFromDirectory_missingOrEmptyDirIsHarmless() throws Exception {
        PluginManager manager = new PluginManager();
        manager.loadFromDirectory(tempDir.resolve("absent"));
        Files.writeString(tempDir.resolve("not-a-jar.jar"), "garbage");
        manager.loadFromDirectory(tempDir);

        assertEquals(0, manager.getExternalCount());
    }
}
