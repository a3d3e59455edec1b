package com.weft.chainer;

import com.weft.admission.AdmissionDecision;
import com.weft.admission.ConfidenceRecord;
import com.weft.admission.PluginBlockedException;
import com.weft.admission.RiskLevel;
import com.weft.admission.StaticAnalysis;
import com.weft.plugin.ExecutablePlugin;
import com.weft.plugin.PluginDescriptor;
import io.micrometer.core.instrument.Timer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PluginChainerTest {

    private ChainerFixture fixture;
    private PluginChainer chainer;

    @BeforeEach
    void setUp() {
        fixture = new ChainerFixture();
        chainer = fixture.chainer;
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private static PluginDescriptor.Builder step(String id) {
        return PluginDescriptor.builder(id).description("Process data step " + id);
    }

    private void addDataPipeline(Map<String, Object> seenByReporter) {
        fixture.add(step("p1").outputTypes("data").build(),
                (command, input) -> Map.of("data", "raw rows"));
        fixture.add(step("p2").inputTypes("data").outputTypes("report").build(),
                (command, input) -> {
                    seenByReporter.putAll(input);
                    return Map.of("report", "report of " + input.get("data"));
                });
        fixture.add(step("p3").inputTypes("report").build(),
                (command, input) -> Map.of("published", Boolean.TRUE));
    }

    @Test
    void buildAndRun_sequentialDataPipeline() {
        Map<String, Object> seenByReporter = new HashMap<>();
        addDataPipeline(seenByReporter);

        PluginChain chain = chainer.buildChain("process data", null, Map.of("source", "db"), ExecutionMode.SEQUENTIAL)
                .orElseThrow();

        assertEquals(List.of("p1", "p2", "p3"), chain.getPluginIds());
        assertEquals(List.of("p1"), chain.getNodes().get(1).getDependencies());
        assertEquals(List.of("p2"), chain.getNodes().get(2).getDependencies());

        ChainResult result = chainer.runChain(chain, Map.of("requestId", "r-1"));

        assertTrue(result.isSuccess());
        assertEquals("raw rows", seenByReporter.get("data"));
        assertEquals("db", seenByReporter.get("source"));
        Map<String, Object> context = result.getContext();
        assertEquals("raw rows", context.get("data"));
        assertEquals("report of raw rows", context.get("report"));
        assertEquals(Boolean.TRUE, context.get("published"));
        assertEquals("r-1", context.get("requestId"));
        assertEquals(List.of("p1", "p2", "p3"), result.getExecutedPluginIds());
    }

    @Test
    void buildChain_metadataDescribesTheBuild() {
        addDataPipeline(new HashMap<>());
        fixture.add(step("orphan").inputTypes("image").build(), (command, input) -> Map.of());

        PluginChain chain = chainer.buildChain("process data", null, null, null).orElseThrow();

        assertEquals(ExecutionMode.ADAPTIVE, chain.getExecutionMode());
        assertTrue(chain.getChainId().startsWith("chain_"));
        Map<String, Object> meta = chain.getMetadata();
        assertEquals("process data", meta.get(PluginChain.META_GOAL));
        assertEquals("auto_chainer", meta.get(PluginChain.META_CREATED_BY));
        assertEquals(3, meta.get(PluginChain.META_PLUGIN_COUNT));
        assertEquals(List.of("orphan"), meta.get(PluginChain.META_DROPPED));
        assertEquals(Map.of(), meta.get(PluginChain.META_BLOCKED));
    }

    @Test
    void buildChain_chainIdsAreMonotonic() {
        addDataPipeline(new HashMap<>());

        String first = chainer.buildChain("process data", null, null, null).orElseThrow().getChainId();
        String second = chainer.buildChain("process data", null, null, null).orElseThrow().getChainId();

        long a = Long.parseLong(first.substring("chain_".length()));
        long b = Long.parseLong(second.substring("chain_".length()));
        assertTrue(b > a);
    }

    @Test
    void buildChain_returnsEmptyWhenNothingMatches() {
        addDataPipeline(new HashMap<>());

        assertTrue(chainer.buildChain("xyz_unmatched_goal", null, null, null).isEmpty());
        assertTrue(chainer.buildChain("  ", null, null, null).isEmpty());
        assertTrue(chainer.buildChain("process data", List.of("not-registered"), null, null).isEmpty());
    }

    @Test
    void buildChain_restrictsToAvailablePlugins() {
        addDataPipeline(new HashMap<>());

        PluginChain chain = chainer.buildChain("process data", List.of("p1", "p2"), null, null).orElseThrow();

        assertEquals(List.of("p1", "p2"), chain.getPluginIds());
    }

    @Test
    void buildChain_dropsBlockedAndRecordsWarnedPlugins() {
        addDataPipeline(new HashMap<>());
        fixture.add(step("risky").build(), (command, input) -> Map.of());
        fixture.add(step("shaky").build(), (command, input) -> Map.of());
        fixture.add(step("steady").build(), (command, input) -> Map.of());
        fixture.add(step("weak").build(), (command, input) -> Map.of());
        fixture.gate.score("risky", new StaticAnalysis(0.9, RiskLevel.HIGH));
        fixture.gate.score("shaky", new StaticAnalysis(0.5, RiskLevel.LOW));
        fixture.gate.score("steady", new StaticAnalysis(0.95, RiskLevel.LOW));
        fixture.gate.score("weak", new StaticAnalysis(0.2, RiskLevel.LOW));

        PluginChain chain = chainer.buildChain("process data", null, null, null).orElseThrow();

        assertFalse(chain.getPluginIds().contains("risky"));
        assertFalse(chain.getPluginIds().contains("weak"));
        assertTrue(chain.getPluginIds().contains("shaky"));
        Map<?, ?> blocked = (Map<?, ?>) chain.getMetadata().get(PluginChain.META_BLOCKED);
        assertEquals(Set.of("risky", "weak"), blocked.keySet());

        AdmissionDecision risky = (AdmissionDecision) blocked.get("risky");
        assertEquals(RiskLevel.HIGH, risky.getRiskLevel());
        assertEquals(0.9, risky.getConfidenceScore(), 1e-9);
        assertEquals(List.of("steady"), alternativeIds(risky));
        assertTrue(risky.getMessage().contains("high risk"));

        AdmissionDecision weak = (AdmissionDecision) blocked.get("weak");
        assertEquals(RiskLevel.LOW, weak.getRiskLevel());
        assertEquals(0.2, weak.getConfidenceScore(), 1e-9);
        assertEquals(List.of("steady", "shaky"), alternativeIds(weak));
        assertTrue(weak.getMessage().contains("low confidence"));

        Map<?, ?> warnings = (Map<?, ?>) chain.getMetadata().get(PluginChain.META_WARNINGS);
        assertTrue(warnings.containsKey("shaky"));
        assertNotNull(warnings.get("shaky"));
    }

    private static List<String> alternativeIds(AdmissionDecision decision) {
        return decision.getAlternatives().stream().map(ConfidenceRecord::getPluginId).toList();
    }

    @Test
    void buildChain_neverProducesForwardDependencies() {
        Random random = new Random(42);
        String[] types = {"a", "b", "c", "d"};
        for (int round = 0; round < 40; round++) {
            try (ChainerFixture f = new ChainerFixture()) {
                int count = 2 + random.nextInt(6);
                for (int i = 0; i < count; i++) {
                    PluginDescriptor.Builder b = step("r" + round + "_" + i)
                            .inputTypes(randomSubset(random, types))
                            .outputTypes(randomSubset(random, types))
                            .chainPriority(random.nextInt(5))
                            .autoChainEligible(random.nextInt(4) == 0);
                    f.add(b.build(), (command, input) -> Map.of());
                }
                f.chainer.buildChain("process data", null, null, null).ifPresent(chain -> {
                    List<String> seen = new ArrayList<>();
                    for (ChainNode node : chain.getNodes()) {
                        assertTrue(seen.containsAll(node.getDependencies()),
                                () -> "forward dependency in " + chain.getNodes());
                        seen.add(node.getPluginId());
                    }
                });
            }
        }
    }

    private static String[] randomSubset(Random random, String[] values) {
        List<String> out = new ArrayList<>();
        for (String v : values) {
            if (random.nextInt(3) == 0) out.add(v);
        }
        return out.toArray(new String[0]);
    }

    @Test
    void runChain_parallelFinishesEachLevelBeforeTheNext() {
        List<String> events = new CopyOnWriteArrayList<>();
        fixture.add(step("collector").outputTypes("data").build(), recording(events, "collector", Map.of("data", 1)));
        fixture.add(step("enricher").outputTypes("meta").build(), recording(events, "enricher", Map.of("meta", 2)));
        fixture.add(step("reporter").inputTypes("data", "meta").outputTypes("report").build(),
                recording(events, "reporter", Map.of("report", 3)));

        PluginChain chain = chainer.buildChain("process data", null, null, ExecutionMode.PARALLEL).orElseThrow();
        assertEquals(List.of("collector", "enricher"), chain.getNodes().get(2).getDependencies());

        ChainResult result = chainer.runChain(chain, null);

        assertTrue(result.isSuccess());
        int reporterStart = events.indexOf("start:reporter");
        assertTrue(events.indexOf("end:collector") < reporterStart);
        assertTrue(events.indexOf("end:enricher") < reporterStart);
        assertEquals(Map.of("data", 1, "meta", 2, "report", 3), result.getContext());
        assertEquals(List.of("collector", "enricher", "reporter"), result.getExecutedPluginIds());
    }

    private static ExecutablePlugin recording(List<String> events, String id, Map<String, Object> out) {
        return (command, input) -> {
            events.add("start:" + id);
            Thread.sleep(20);
            events.add("end:" + id);
            return out;
        };
    }

    @Test
    void runChain_parallelFailureKeepsContextOfLastCompleteLevel() {
        fixture.add(step("loader").outputTypes("data").build(), (command, input) -> Map.of("data", "rows"));
        fixture.add(step("good").inputTypes("data").build(), (command, input) -> Map.of("good", "yes"));
        fixture.add(step("bad").inputTypes("data").build(), (command, input) -> {
            throw new IllegalStateException("boom");
        });

        PluginChain chain = chainer.buildChain("process data", null, null, ExecutionMode.PARALLEL).orElseThrow();
        ChainResult result = chainer.runChain(chain, null);

        assertFalse(result.isSuccess());
        ChainExecutionException error = result.getError().orElseThrow();
        assertEquals("bad", error.getPluginId());
        assertEquals(chain.getChainId(), error.getChainId());
        assertInstanceOf(IllegalStateException.class, error.getCause());
        assertEquals(Map.of("data", "rows"), result.getContext());
        assertEquals(List.of("loader"), result.getExecutedPluginIds());
    }

    @Test
    void runChain_sequentialFailureStopsAndRecordsOutcome() {
        fixture.add(step("first").outputTypes("data").build(), (command, input) -> Map.of("data", "rows"));
        fixture.add(step("second").inputTypes("data").outputTypes("report").build(), (command, input) -> {
            throw new IllegalArgumentException("bad rows");
        });
        fixture.add(step("third").inputTypes("report").build(), (command, input) -> Map.of("never", true));

        PluginChain chain = chainer.buildChain("process data", null, null, ExecutionMode.SEQUENTIAL).orElseThrow();
        ChainResult result = chainer.runChain(chain, null);

        assertFalse(result.isSuccess());
        assertEquals("second", result.getError().orElseThrow().getPluginId());
        assertEquals(Map.of("data", "rows"), result.getContext());
        assertFalse(chain.getNodes().get(2).isExecuted());

        assertEquals(1, fixture.gate.snapshot("second").orElseThrow().getUsageCount());
        assertEquals("IllegalArgumentException", fixture.gate.snapshot("second").orElseThrow().getLastError().type());
        assertEquals(0.0, fixture.index.find("second").orElseThrow().getStatistics().getSuccessRate(), 1e-9);
        assertEquals(1, fixture.index.find("first").orElseThrow().getStatistics().getUsageCount());

        Timer failed = fixture.meters.find(ChainMetrics.PLUGIN_EXECUTION_TIMER)
                .tag("pluginId", "second").tag("success", "false").timer();
        assertNotNull(failed);
        assertEquals(1, failed.count());
        assertNotNull(fixture.meters.find(ChainMetrics.NODE_EXECUTIONS_COUNTER).counter());
    }

    @Test
    void runChain_blockedAtRunTimeFailsWithoutExecuting() {
        List<String> calls = new CopyOnWriteArrayList<>();
        fixture.add(step("solo").build(), (command, input) -> {
            calls.add(command);
            return Map.of();
        });
        PluginChain chain = chainer.buildChain("process data", null, null, null).orElseThrow();
        fixture.gate.score("solo", new StaticAnalysis(0.9, RiskLevel.CRITICAL));

        ChainResult result = chainer.runChain(chain, null);

        assertFalse(result.isSuccess());
        PluginBlockedException blocked = assertInstanceOf(PluginBlockedException.class,
                result.getError().orElseThrow().getCause());
        assertEquals(RiskLevel.CRITICAL, blocked.getRiskLevel());
        assertTrue(calls.isEmpty());
        assertEquals(0, fixture.gate.snapshot("solo").orElseThrow().getUsageCount());
    }

    @Test
    void runChain_passesAutoChainCommand() {
        List<String> commands = new CopyOnWriteArrayList<>();
        fixture.add(step("solo").build(), (command, input) -> {
            commands.add(command);
            return null;
        });

        ChainResult result = chainer.runChain(chainer.buildChain("process data", null, null, null).orElseThrow(), null);

        assertTrue(result.isSuccess());
        assertEquals(List.of(NodeInvoker.COMMAND), commands);
    }

    @Test
    void runChain_adaptiveUsesCallerThreadWithoutDependencies() {
        List<String> threads = new CopyOnWriteArrayList<>();
        fixture.add(step("one").build(), threadRecording(threads));
        fixture.add(step("two").build(), threadRecording(threads));

        PluginChain chain = chainer.buildChain("process data", null, null, ExecutionMode.ADAPTIVE).orElseThrow();
        chainer.runChain(chain, null);

        assertEquals(2, threads.size());
        String caller = Thread.currentThread().getName();
        assertTrue(threads.stream().allMatch(caller::equals));
    }

    @Test
    void runChain_adaptiveUsesWorkerThreadsWithDependencies() {
        List<String> threads = new CopyOnWriteArrayList<>();
        fixture.add(step("one").outputTypes("data").build(), threadRecording(threads));
        fixture.add(step("two").inputTypes("data").build(), threadRecording(threads));

        PluginChain chain = chainer.buildChain("process data", null, null, ExecutionMode.ADAPTIVE).orElseThrow();
        chainer.runChain(chain, null);

        assertEquals(2, threads.size());
        assertTrue(threads.stream().allMatch(name -> name.startsWith("weft-chain-")));
    }

    private static ExecutablePlugin threadRecording(List<String> threads) {
        return (command, input) -> {
            threads.add(Thread.currentThread().getName());
            return Map.of();
        };
    }

    @Test
    void runChain_rejectsConcurrentRunOfSameChain() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        fixture.add(step("slow").build(), (command, input) -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return Map.of("done", true);
        });
        PluginChain chain = chainer.buildChain("process data", null, null, ExecutionMode.SEQUENTIAL).orElseThrow();

        ExecutorService caller = Executors.newSingleThreadExecutor();
        try {
            Future<ChainResult> first = caller.submit(() -> chainer.runChain(chain, null));
            assertTrue(started.await(5, TimeUnit.SECONDS));
            assertTrue(chainer.getChainStatus(chain.getChainId()).orElseThrow().running());

            assertThrows(IllegalStateException.class, () -> chainer.runChain(chain, null));

            release.countDown();
            assertTrue(first.get(5, TimeUnit.SECONDS).isSuccess());
            assertFalse(chain.isRunning());
            assertTrue(chainer.runChain(chain, null).isSuccess());
        } finally {
            release.countDown();
            caller.shutdownNow();
        }
    }

    @Test
    void chainStatusAndCleanup() {
        addDataPipeline(new HashMap<>());
        PluginChain chain = chainer.buildChain("process data", null, null, ExecutionMode.SEQUENTIAL).orElseThrow();

        ChainStatus before = chainer.getChainStatus(chain.getChainId()).orElseThrow();
        assertEquals(3, before.totalPlugins());
        assertEquals(0, before.executedPlugins());
        assertEquals(0.0, before.progress(), 1e-9);
        assertEquals(ExecutionMode.SEQUENTIAL, before.executionMode());

        chainer.runChain(chain, null);

        ChainStatus after = chainer.getChainStatus(chain.getChainId()).orElseThrow();
        assertEquals(3, after.executedPlugins());
        assertEquals(1.0, after.progress(), 1e-9);
        assertEquals("process data", after.metadata().get(PluginChain.META_GOAL));

        assertTrue(chainer.cleanupChain(chain.getChainId()));
        assertFalse(chainer.cleanupChain(chain.getChainId()));
        assertTrue(chainer.getChainStatus(chain.getChainId()).isEmpty());
        assertTrue(chainer.getChainStatus("chain_unknown").isEmpty());
        assertFalse(chainer.cleanupChain(null));
    }

    @Test
    void runChain_recordsChainRunMetric() {
        addDataPipeline(new HashMap<>());

        chainer.runChain(chainer.buildChain("process data", null, null, ExecutionMode.SEQUENTIAL).orElseThrow(), null);

        assertEquals(1.0, fixture.meters.get(ChainMetrics.CHAIN_RUNS_COUNTER)
                .tag("mode", "SEQUENTIAL").tag("success", "true").counter().count(), 1e-9);
    }
}
