package com.weft.chainer;

import com.weft.admission.AdmissionDecision;
import com.weft.admission.AdmissionGate;
import com.weft.chainer.strategy.AdaptiveStrategy;
import com.weft.chainer.strategy.ExecutionStrategy;
import com.weft.chainer.strategy.ParallelStrategy;
import com.weft.chainer.strategy.SequentialStrategy;
import com.weft.config.WeftConfig;
import com.weft.discovery.DiscoveryCandidate;
import com.weft.discovery.DiscoveryIndex;
import com.weft.plugin.ExecutablePlugin;
import com.weft.plugin.PluginDescriptor;
import com.weft.plugin.PluginRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Builds plugin chains for a goal and runs them.
 * <p>
 * {@link #buildChain} asks the discovery index for ranked candidates, lets the admission gate drop
 * blocked plugins, orders the rest greedily by declared input/output types and registers the chain.
 * {@link #runChain} runs a chain under its {@link ExecutionMode}; parallel levels use a fixed pool owned
 * by this chainer, so close it when done.
 */
public final class PluginChainer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PluginChainer.class);

    static final String CREATED_BY = "auto_chainer";
    static final String SUGGESTION_GOAL_PREFIX = "Process: ";
    static final int SUGGESTION_DISCOVERY_LIMIT = 10;
    static final double RELEVANCE_PER_PLUGIN = 0.1;
    static final int SECONDS_PER_NODE = 2;

    private final PluginRegistry registry;
    private final DiscoveryIndex discovery;
    private final AdmissionGate admission;
    private final ChainMetrics metrics;
    private final NodeInvoker invoker;
    private final ExecutorService executor;
    private final Map<ExecutionMode, ExecutionStrategy> strategies = new EnumMap<>(ExecutionMode.class);
    private final Map<String, PluginChain> chains = new ConcurrentHashMap<>();
    private final AtomicLong chainCounter = new AtomicLong();
    private final int suggestionLimit;

    public PluginChainer(PluginRegistry registry, DiscoveryIndex discovery, AdmissionGate admission, WeftConfig config) {
        this(registry, discovery, admission, config,
                Objects.requireNonNull(config, "WeftConfig").isMetricsEnabled() ? new SimpleMeterRegistry() : null);
    }

    /**
     * @param meterRegistry registry for chain metrics; null disables metrics
     */
    public PluginChainer(PluginRegistry registry, DiscoveryIndex discovery, AdmissionGate admission,
                         WeftConfig config, MeterRegistry meterRegistry) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.discovery = Objects.requireNonNull(discovery, "discovery");
        this.admission = Objects.requireNonNull(admission, "admission");
        Objects.requireNonNull(config, "WeftConfig");
        this.metrics = new ChainMetrics(meterRegistry);
        this.invoker = new NodeInvoker(admission, discovery, metrics);
        this.executor = Executors.newFixedThreadPool(config.getChainParallelism(), new ChainThreadFactory());
        this.suggestionLimit = config.getSuggestionLimit();
        ExecutionStrategy sequential = new SequentialStrategy();
        ExecutionStrategy parallel = new ParallelStrategy(executor);
        strategies.put(ExecutionMode.SEQUENTIAL, sequential);
        strategies.put(ExecutionMode.PARALLEL, parallel);
        strategies.put(ExecutionMode.ADAPTIVE, new AdaptiveStrategy(sequential, parallel));
    }

    public ChainMetrics getMetrics() {
        return metrics;
    }

    /**
     * Builds and registers a chain for the goal.
     *
     * @param goal             goal text passed to discovery
     * @param availablePlugins plugin ids to consider; null or empty means every registered plugin
     * @param inputData        initial data kept on the chain; may be null
     * @param mode             execution mode; null means ADAPTIVE
     * @return the chain, or empty when no candidate survives discovery, admission and the greedy build
     */
    public Optional<PluginChain> buildChain(String goal, Collection<String> availablePlugins,
                                            Map<String, Object> inputData, ExecutionMode mode) {
        if (goal == null || goal.isBlank()) {
            log.warn("Cannot build chain for blank goal");
            return Optional.empty();
        }
        Set<String> candidates = availableIds(availablePlugins);
        if (candidates.isEmpty()) {
            log.warn("No registered plugins available for goal={}", goal);
            return Optional.empty();
        }

        List<PluginDescriptor> admitted = new ArrayList<>();
        Map<String, String> warnings = new LinkedHashMap<>();
        Map<String, AdmissionDecision> blocked = new LinkedHashMap<>();
        // Rank against the whole index so plugins outside the available set cannot crowd out candidates.
        int limit = Math.max(candidates.size(), registry.size());
        for (DiscoveryCandidate candidate : discovery.query(goal, limit)) {
            String id = candidate.getPluginId();
            PluginDescriptor descriptor = candidates.contains(id) ? registry.getDescriptor(id) : null;
            if (descriptor == null) {
                continue;
            }
            AdmissionDecision decision = admission.evaluate(id);
            if (decision.isBlocked()) {
                blocked.put(id, decision);
                continue;
            }
            if (decision.isWarned()) {
                warnings.put(id, decision.getMessage());
            }
            admitted.add(descriptor);
        }
        if (admitted.isEmpty()) {
            log.warn("No chain path found for goal={} (blocked={})", goal, blocked.keySet());
            return Optional.empty();
        }

        ChainBuilder.Plan plan = ChainBuilder.plan(admitted);
        List<ChainNode> nodes = new ArrayList<>(plan.ordered().size());
        for (int i = 0; i < plan.ordered().size(); i++) {
            PluginDescriptor descriptor = plan.ordered().get(i);
            ExecutablePlugin plugin = registry.getExecutable(descriptor.getIdentity());
            if (plugin == null) {
                log.warn("Plugin unregistered during chain build, skipping pluginId={}", descriptor.getIdentity());
                continue;
            }
            List<String> deps = ChainBuilder.dependencies(descriptor, plan.ordered().subList(0, i));
            nodes.add(new ChainNode(descriptor.getIdentity(), plugin, deps));
        }
        if (nodes.isEmpty()) {
            log.warn("No chain path found for goal={} (no reachable plugin)", goal);
            return Optional.empty();
        }

        String chainId = "chain_" + chainCounter.getAndIncrement();
        Instant createdAt = Instant.now();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(PluginChain.META_GOAL, goal);
        metadata.put(PluginChain.META_CREATED_BY, CREATED_BY);
        metadata.put(PluginChain.META_CREATED_AT, createdAt.toString());
        metadata.put(PluginChain.META_PLUGIN_COUNT, nodes.size());
        metadata.put(PluginChain.META_WARNINGS, Collections.unmodifiableMap(warnings));
        metadata.put(PluginChain.META_BLOCKED, Collections.unmodifiableMap(blocked));
        metadata.put(PluginChain.META_DROPPED, plan.dropped());

        PluginChain chain = new PluginChain(chainId, nodes,
                mode != null ? mode : ExecutionMode.ADAPTIVE, metadata, inputData, createdAt);
        chains.put(chainId, chain);
        log.info("Built chain chainId={} plugins={} mode={} warned={} blocked={} dropped={}",
                chainId, chain.getPluginIds(), chain.getExecutionMode(), warnings.keySet(), blocked.keySet(), plan.dropped());
        return Optional.of(chain);
    }

    /**
     * Runs the chain. The initial context is the chain's build-time data overlaid with {@code initialData}.
     * Node failures come back in the result together with the context committed so far.
     *
     * @throws IllegalStateException if the chain is already running
     */
    public ChainResult runChain(PluginChain chain, Map<String, Object> initialData) {
        Objects.requireNonNull(chain, "chain");
        if (!chain.tryClaim()) {
            throw new IllegalStateException("Chain is already running: " + chain.getChainId());
        }
        try {
            for (ChainNode node : chain.getNodes()) {
                node.reset();
            }
            Map<String, Object> context = new LinkedHashMap<>(chain.getInitialData());
            if (initialData != null) {
                context.putAll(initialData);
            }
            log.info("Executing chain chainId={} mode={} plugins={}",
                    chain.getChainId(), chain.getExecutionMode(), chain.getNodes().size());
            ChainResult result = strategies.get(chain.getExecutionMode()).run(chain, context, invoker);
            metrics.recordChain(chain.getExecutionMode(), result.isSuccess());
            if (result.isSuccess()) {
                log.info("Chain completed chainId={} executed={}", chain.getChainId(), result.getExecutedPluginIds().size());
            } else {
                log.warn("Chain failed chainId={} failedPlugin={} executed={}", chain.getChainId(),
                        result.getError().map(ChainExecutionException::getPluginId).orElse(null),
                        result.getExecutedPluginIds());
            }
            return result;
        } finally {
            chain.release();
        }
    }

    /**
     * Suggests chains for a request: discovery results are grouped by category and every group of at least
     * two plugins yields an ADAPTIVE trial chain. Trial chains are registered but never run.
     *
     * @param context data kept as each trial chain's initial data; may be null
     * @return suggestions by descending relevance
     */
    public List<ChainSuggestion> suggestChains(String userInput, Map<String, Object> context) {
        if (userInput == null || userInput.isBlank()) {
            return List.of();
        }
        Map<String, List<String>> groups = new LinkedHashMap<>();
        for (DiscoveryCandidate candidate : discovery.query(userInput, SUGGESTION_DISCOVERY_LIMIT)) {
            PluginDescriptor descriptor = registry.getDescriptor(candidate.getPluginId());
            if (descriptor == null) {
                continue;
            }
            groups.computeIfAbsent(descriptor.getCategory(), k -> new ArrayList<>()).add(descriptor.getIdentity());
        }
        List<ChainSuggestion> suggestions = new ArrayList<>();
        for (Map.Entry<String, List<String>> group : groups.entrySet()) {
            List<String> members = group.getValue();
            if (members.size() < 2) {
                continue;
            }
            Optional<PluginChain> trial = buildChain(SUGGESTION_GOAL_PREFIX + userInput, members, context, ExecutionMode.ADAPTIVE);
            if (trial.isEmpty()) {
                continue;
            }
            PluginChain chain = trial.get();
            suggestions.add(new ChainSuggestion(
                    chain.getChainId(),
                    "Use " + group.getKey() + " plugins to " + userInput.toLowerCase(Locale.ROOT),
                    chain.getPluginIds(),
                    chain.getExecutionMode(),
                    members.size() * RELEVANCE_PER_PLUGIN,
                    chain.getNodes().size() * SECONDS_PER_NODE));
        }
        suggestions.sort(Comparator.comparingDouble(ChainSuggestion::relevanceScore).reversed());
        return suggestions.size() > suggestionLimit ? List.copyOf(suggestions.subList(0, suggestionLimit)) : suggestions;
    }

    public Optional<ChainStatus> getChainStatus(String chainId) {
        PluginChain chain = chainId != null ? chains.get(chainId) : null;
        return chain != null ? Optional.of(ChainStatus.of(chain)) : Optional.empty();
    }

    public Optional<PluginChain> getChain(String chainId) {
        return chainId != null ? Optional.ofNullable(chains.get(chainId)) : Optional.empty();
    }

    /** Removes a chain from the registry; false when it is unknown. */
    public boolean cleanupChain(String chainId) {
        if (chainId == null) return false;
        boolean removed = chains.remove(chainId) != null;
        if (removed) {
            log.debug("Chain removed chainId={}", chainId);
        }
        return removed;
    }

    public int activeChainCount() {
        return chains.size();
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Chain executor did not terminate in time; forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private Set<String> availableIds(Collection<String> availablePlugins) {
        Set<String> out = new LinkedHashSet<>();
        if (availablePlugins == null || availablePlugins.isEmpty()) {
            out.addAll(registry.ids());
            return out;
        }
        for (String id : availablePlugins) {
            if (id != null && registry.contains(id)) {
                out.add(id.trim());
            }
        }
        return out;
    }

    private static final class ChainThreadFactory implements ThreadFactory {
        private final AtomicInteger seq = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "weft-chain-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
