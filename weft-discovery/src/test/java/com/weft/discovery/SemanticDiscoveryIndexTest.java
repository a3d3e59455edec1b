package com.weft.discovery;

import com.weft.discovery.store.InMemoryDiscoveryStore;
import com.weft.plugin.PluginDescriptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SemanticDiscoveryIndexTest {

    private InMemoryDiscoveryStore store;
    private SemanticDiscoveryIndex index;

    @BeforeEach
    void setUp() {
        store = new InMemoryDiscoveryStore();
        index = new SemanticDiscoveryIndex(store);
    }

    private static PluginDescriptor plugin(String id, String description) {
        return PluginDescriptor.builder(id).description(description).build();
    }

    @Test
    void query_goalWithNoOverlap_returnsEmptyList() {
        index.index(plugin("perf", "Monitor performance of services"));
        index.index(plugin("etl", "Process data files"));

        assertTrue(index.query("xyz_unmatched_goal", 5).isEmpty());
    }

    @Test
    void query_blankGoalOrNonPositiveLimit_returnsEmptyList() {
        index.index(plugin("etl", "Process data files"));

        assertTrue(index.query("  ", 5).isEmpty());
        assertTrue(index.query(null, 5).isEmpty());
        assertTrue(index.query("process data", 0).isEmpty());
    }

    @Test
    void query_directMatch_returnsEachPluginOnceWithBestRelevance() {
        index.index(plugin("perf", "Monitor performance of services"));

        List<DiscoveryCandidate> result = index.query("Monitor Performance", 5);

        assertEquals(1, result.size());
        DiscoveryCandidate c = result.get(0);
        assertEquals("perf", c.getPluginId());
        assertEquals(MatchType.DIRECT, c.getMatchType());
        assertEquals(2.0 / 3.0, c.getRelevance(), 1e-9);
        assertTrue(c.getGoals().contains("monitor performance"));
        assertTrue(c.getSummary().startsWith("This is a general plugin."));
    }

    @Test
    void query_tiesBrokenBySuccessRateThenIdentity() {
        index.index(plugin("beta", "Process data files"));
        index.index(plugin("alpha", "Process data files"));

        assertEquals(List.of("alpha", "beta"), ids(index.query("process data", 5)));

        index.recordOutcome("alpha", false, 1.0);
        index.recordOutcome("beta", true, 1.0);

        assertEquals(List.of("beta", "alpha"), ids(index.query("process data", 5)));
    }

    @Test
    void query_moreSuccessfulPluginNeverRanksLower() {
        index.index(plugin("a", "Analyze code quality"));
        index.index(plugin("b", "Analyze code quality"));
        for (int i = 0; i < 3; i++) {
            index.recordOutcome("a", true, 0.5);
            index.recordOutcome("b", i == 0, 0.5);
        }

        List<DiscoveryCandidate> result = index.query("analyze code", 5);

        assertEquals("a", result.get(0).getPluginId());
        assertTrue(result.get(0).getSuccessRate() > result.get(1).getSuccessRate());
    }

    @Test
    void query_respectsLimit() {
        for (int i = 0; i < 4; i++) {
            index.index(plugin("etl" + i, "Process data files"));
        }
        assertEquals(2, index.query("process data", 2).size());
    }

    @Test
    void query_fallsBackToKeywordSearch() {
        index.index(PluginDescriptor.builder("formatter").description("Pretty prints JSON documents").tags("json").build());

        List<DiscoveryCandidate> result = index.query("format json output", 5);

        assertEquals(1, result.size());
        assertEquals(MatchType.FUZZY, result.get(0).getMatchType());
        assertEquals(0.5 / 3.0, result.get(0).getRelevance(), 1e-9);
    }

    @Test
    void index_unchangedDescriptorIsNoOp_andReindexKeepsStatistics() {
        PluginDescriptor first = plugin("etl", "Process data files");
        assertTrue(index.index(first));
        index.recordOutcome("etl", true, 2.0);
        List<GoalIndexEntry> before = store.goalMappings("etl");

        assertTrue(index.index(first));
        assertEquals(before, store.goalMappings("etl"));
        assertEquals(1, index.find("etl").orElseThrow().getStatistics().getUsageCount());

        assertTrue(index.index(plugin("etl", "Validate schema")));
        IndexedPlugin reindexed = index.find("etl").orElseThrow();
        assertEquals(List.of("validate schema"), reindexed.getGoals());
        assertEquals(1, reindexed.getStatistics().getUsageCount());
        assertEquals(1, store.goalMappings("etl").size());
    }

    @Test
    void recordOutcome_keepsCumulativeAverages() {
        index.index(plugin("etl", "Process data files"));

        index.recordOutcome("etl", true, 2.0);
        index.recordOutcome("etl", false, 4.0);

        PluginStatistics stats = index.find("etl").orElseThrow().getStatistics();
        assertEquals(2, stats.getUsageCount());
        assertEquals(0.5, stats.getSuccessRate(), 1e-9);
        assertEquals(3.0, stats.getAverageExecutionTime(), 1e-9);
    }

    @Test
    void recordOutcome_unknownPluginIsNoOp() {
        index.recordOutcome("ghost", true, 1.0);

        assertTrue(index.find("ghost").isEmpty());
        assertThrows(IllegalArgumentException.class, () -> index.recordOutcome(" ", true, 1.0));
    }

    @Test
    void remove_dropsPluginAndMappings() {
        index.index(plugin("etl", "Process data files"));

        assertTrue(index.remove("etl"));
        assertFalse(index.remove("etl"));
        assertTrue(index.query("process data", 5).isEmpty());
        assertTrue(store.goalMappings("etl").isEmpty());
    }

    @Test
    void locks_areNotKeptForUnknownOrRemovedPlugins() {
        for (int i = 0; i < 50; i++) {
            index.recordOutcome("ghost-" + i, true, 1.0);
        }
        assertEquals(0, index.lockCount());

        index.index(plugin("etl", "Process data files"));
        index.recordOutcome("etl", true, 1.0);
        assertEquals(1, index.lockCount());

        assertTrue(index.remove("etl"));
        assertEquals(0, index.lockCount());
        index.recordOutcome("etl", true, 1.0);
        assertEquals(0, index.lockCount());
        assertTrue(index.find("etl").isEmpty());
    }

    @Test
    void recordOutcome_concurrentUpdatesAreSerialized() throws Exception {
        index.index(plugin("etl", "Process data files"));
        int threads = 8;
        int perThread = 50;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < perThread; i++) {
                        index.recordOutcome("etl", i % 2 == 0, 2.0);
                    }
                }));
            }
            for (Future<?> f : futures) {
                f.get();
            }
        } finally {
            pool.shutdownNow();
        }

        PluginStatistics stats = index.find("etl").orElseThrow().getStatistics();
        assertEquals(threads * perThread, stats.getUsageCount());
        assertEquals(0.5, stats.getSuccessRate(), 1e-9);
        assertEquals(2.0, stats.getAverageExecutionTime(), 1e-9);
    }

    @Test
    void storeFailures_degradeToEmptyResults() {
        SemanticDiscoveryIndex broken = new SemanticDiscoveryIndex(new FailingDiscoveryStore());

        assertFalse(broken.index(plugin("etl", "Process data files")));
        assertTrue(broken.query("process data", 5).isEmpty());
        assertTrue(broken.find("etl").isEmpty());
        assertFalse(broken.remove("etl"));
        broken.recordOutcome("etl", true, 1.0);
    }

    @Test
    void query_directMatchNeverRanksBelowKeywordMatch() {
        index.index(PluginDescriptor.builder("formatter")
                .description("Pretty prints JSON documents").tags("json").build());
        index.index(plugin("validator", "Validate json payloads"));
        for (int i = 0; i < 5; i++) {
            index.recordOutcome("formatter", true, 0.1);
        }

        List<DiscoveryCandidate> result = index.query("validate json", 5);

        assertEquals(List.of("validator"), ids(result));
        assertEquals(MatchType.DIRECT, result.get(0).getMatchType());
    }

    @Test
    void indexAll_countsIndexedPlugins() {
        int n = index.indexAll(List.of(plugin("a", "Process data"), plugin("b", "Debug code")));
        assertEquals(2, n);
    }

    private static List<String> ids(List<DiscoveryCandidate> candidates) {
        return candidates.stream().map(DiscoveryCandidate::getPluginId).toList();
    }
}
