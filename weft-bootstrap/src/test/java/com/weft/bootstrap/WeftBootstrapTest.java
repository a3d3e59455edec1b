package com.weft.bootstrap;

import com.weft.admission.AdmissionState;
import com.weft.admission.RiskLevel;
import com.weft.admission.StaticAnalysis;
import com.weft.chainer.ChainResult;
import com.weft.chainer.PluginChain;
import com.weft.config.WeftConfig;
import com.weft.plugin.PluginDescriptor;
import com.weft.plugin.PluginRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WeftBootstrapTest {

    @TempDir
    Path tempDir;

    private WeftConfig config;

    @BeforeEach
    void setUp() throws Exception {
        Path manifests = Files.createDirectories(tempDir.resolve("manifests"));
        Files.writeString(manifests.resolve("csv-loader.json"), """
                {"id": "csv-loader", "description": "Process data files from CSV exports",
                 "category": "data", "tags": ["tabular"], "outputTypes": ["rows"]}
                """);
        Files.writeString(manifests.resolve("ghost.json"), """
                {"id": "ghost", "description": "Process data for a plugin nobody ships"}
                """);
        config = WeftConfig.builder()
                .dbUrl("jdbc:h2:mem:weft-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1")
                .dbUser("sa")
                .dbPassword("")
                .pluginsDir(tempDir.resolve("plugins").toString())
                .manifestDir(manifests.toString())
                .chainParallelism(2)
                .build();
    }

    @Test
    void initialize_wiresProvidersManifestsDiscoveryAdmissionAndChainer() {
        try (BootstrapContext ctx = WeftBootstrap.initialize(config, d -> new StaticAnalysis(0.9, RiskLevel.LOW))) {
            assertEquals(List.of("csv-loader"), ctx.getRegistry().ids());
            assertEquals("Process data files from CSV exports",
                    ctx.getRegistry().getDescriptor("csv-loader").getDescription());
            assertEquals(List.of("csv-loader"), ctx.getDiscovery().findRelevantPlugins("process data", 5));
            assertTrue(ctx.getDiscovery().getIndex().find("ghost").isEmpty());
            assertEquals(0.9, ctx.getAdmission().snapshot("csv-loader").orElseThrow().getConfidenceScore(), 1e-9);

            PluginChain chain = ctx.getChainer().buildChain("process data", null, Map.of(), null).orElseThrow();
            ChainResult result = ctx.getChainer().runChain(chain, Map.of());

            assertTrue(result.isSuccess());
            assertEquals(List.of("csv-loader"), result.getExecutedPluginIds());
            assertEquals(3, result.getContext().get("rows"));
            assertEquals(1, ctx.getDiscovery().getIndex().find("csv-loader").orElseThrow()
                    .getStatistics().getUsageCount());
            assertEquals(1, ctx.getAdmission().snapshot("csv-loader").orElseThrow().getUsageCount());
        }
    }

    @Test
    void initialize_withoutAnalyzerLeavesPluginsUnscored() {
        try (BootstrapContext ctx = WeftBootstrap.initialize(config, null)) {
            assertTrue(ctx.getAdmission().snapshot("csv-loader").isEmpty());
            assertEquals(AdmissionState.UNSCORED, ctx.getAdmission().evaluate("csv-loader").getState());
            assertFalse(ctx.getChainer().buildChain("process data", null, null, null).isEmpty());
        }
    }

    @Test
    void applyManifests_skipsUnregisteredIdentities() {
        PluginRegistry registry = new PluginRegistry();
        registry.register(PluginDescriptor.builder("a").build(), (command, input) -> Map.of());

        List<String> applied = WeftBootstrap.applyManifests(registry, List.of(
                PluginDescriptor.builder("a").description("Validate schema").build(),
                PluginDescriptor.builder("b").build()));

        assertEquals(List.of("a"), applied);
        assertEquals("Validate schema", registry.getDescriptor("a").getDescription());
        assertFalse(registry.contains("b"));
    }
}
