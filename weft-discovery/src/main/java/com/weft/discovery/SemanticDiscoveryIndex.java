package com.weft.discovery;

import com.weft.discovery.store.DiscoveryStore;
import com.weft.discovery.store.DiscoveryStoreException;
import com.weft.discovery.store.GoalMatcher;
import com.weft.plugin.PluginDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link DiscoveryIndex} over a {@link DiscoveryStore}. Goal fragments come from
 * {@link GoalPatternExtractor}; queries try the direct fragment path first and fall back to keyword
 * search over plugin text. Writes for one plugin identity are serialized; different identities
 * do not contend.
 */
public final class SemanticDiscoveryIndex implements DiscoveryIndex {

    private static final Logger log = LoggerFactory.getLogger(SemanticDiscoveryIndex.class);

    static final double FUZZY_MAX_RELEVANCE = 0.5;
    private static final int MIN_TOKEN_LENGTH = 3;

    /** Relevance desc, success rate desc, usage desc, identity asc. */
    static final Comparator<DiscoveryCandidate> RANKING = Comparator
            .comparingDouble(DiscoveryCandidate::getRelevance).reversed()
            .thenComparing(Comparator.comparingDouble(DiscoveryCandidate::getSuccessRate).reversed())
            .thenComparing(Comparator.comparingLong(DiscoveryCandidate::getUsageCount).reversed())
            .thenComparing(DiscoveryCandidate::getPluginId);

    private final DiscoveryStore store;
    private final GoalPatternExtractor extractor;
    private final Map<String, Object> locks = new ConcurrentHashMap<>();

    public SemanticDiscoveryIndex(DiscoveryStore store) {
        this(store, new GoalPatternExtractor());
    }

    public SemanticDiscoveryIndex(DiscoveryStore store, GoalPatternExtractor extractor) {
        this.store = Objects.requireNonNull(store, "store");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
    }

    @Override
    public boolean index(PluginDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        String id = descriptor.getIdentity();
        String summary = extractor.summarize(descriptor);
        List<String> goals = extractor.extractGoals(descriptor, summary);
        String hash = GoalPatternExtractor.contentHash(descriptor, goals);
        synchronized (lockFor(id)) {
            try {
                Optional<IndexedPlugin> existing = store.findPlugin(id);
                if (existing.isPresent() && hash.equals(existing.get().getContentHash())) {
                    log.debug("Plugin unchanged; skipping re-index pluginId={}", id);
                    return true;
                }
                PluginStatistics stats = existing.map(IndexedPlugin::getStatistics).orElse(PluginStatistics.INITIAL);
                IndexedPlugin plugin = new IndexedPlugin(id, descriptor.getDescription(), summary,
                        descriptor.getCategory(), descriptor.getTags(), descriptor.getCapabilities(), goals,
                        hash, stats, Instant.now());
                store.replacePlugin(plugin, extractor.toEntries(id, goals));
                log.info("Plugin indexed pluginId={} goals={} reindex={}", id, goals.size(), existing.isPresent());
                return true;
            } catch (DiscoveryStoreException e) {
                log.error("Indexing failed pluginId={} operation={}: {}", id, e.getOperation(), e.getMessage());
                return false;
            }
        }
    }

    @Override
    public List<DiscoveryCandidate> query(String goalText, int limit) {
        if (goalText == null || goalText.isBlank() || limit <= 0) {
            return List.of();
        }
        String goal = normalize(goalText);
        String[] tokens = goal.split(" ");
        String firstToken = tokens[0].length() >= MIN_TOKEN_LENGTH ? tokens[0] : null;
        try {
            List<DiscoveryCandidate> candidates = directMatches(goal, firstToken);
            if (candidates.isEmpty()) {
                candidates = fuzzyMatches(tokens);
            }
            candidates.sort(RANKING);
            List<DiscoveryCandidate> out = candidates.size() > limit ? new ArrayList<>(candidates.subList(0, limit)) : candidates;
            log.debug("Discovery query goal='{}' candidates={} returned={}", goal, candidates.size(), out.size());
            return out;
        } catch (DiscoveryStoreException e) {
            log.error("Discovery query failed goal='{}' operation={}: {}", goal, e.getOperation(), e.getMessage());
            return List.of();
        }
    }

    private List<DiscoveryCandidate> directMatches(String goal, String firstToken) {
        Map<String, Double> best = new LinkedHashMap<>();
        for (GoalIndexEntry e : store.findGoalMappings(goal, firstToken)) {
            if (!GoalMatcher.matches(e.getGoalPattern(), goal, firstToken)) continue;
            best.merge(e.getPluginId(), e.getRelevance(), Math::max);
        }
        List<DiscoveryCandidate> out = new ArrayList<>(best.size());
        for (Map.Entry<String, Double> e : best.entrySet()) {
            store.findPlugin(e.getKey())
                    .ifPresent(p -> out.add(new DiscoveryCandidate(p, e.getValue(), MatchType.DIRECT)));
        }
        return out;
    }

    private List<DiscoveryCandidate> fuzzyMatches(String[] tokens) {
        Set<String> keywords = new LinkedHashSet<>();
        for (String t : tokens) {
            if (t.length() > 2) keywords.add(t);
        }
        if (keywords.isEmpty()) {
            return new ArrayList<>();
        }
        Map<String, Integer> hits = new LinkedHashMap<>();
        for (String keyword : keywords) {
            for (String pluginId : store.findPluginsMentioning(keyword)) {
                hits.merge(pluginId, 1, Integer::sum);
            }
        }
        List<DiscoveryCandidate> out = new ArrayList<>(hits.size());
        for (Map.Entry<String, Integer> e : hits.entrySet()) {
            double relevance = FUZZY_MAX_RELEVANCE * e.getValue() / keywords.size();
            store.findPlugin(e.getKey())
                    .ifPresent(p -> out.add(new DiscoveryCandidate(p, relevance, MatchType.FUZZY)));
        }
        return out;
    }

    @Override
    public void recordOutcome(String pluginId, boolean success, double executionTimeSeconds) {
        if (pluginId == null || pluginId.isBlank()) {
            throw new IllegalArgumentException("pluginId must be non-blank");
        }
        String id = pluginId.trim();
        try {
            if (!locks.containsKey(id) && store.findPlugin(id).isEmpty()) {
                log.debug("Outcome for unindexed plugin ignored pluginId={}", id);
                return;
            }
        } catch (DiscoveryStoreException e) {
            log.error("Recording outcome failed pluginId={} operation={}: {}", id, e.getOperation(), e.getMessage());
            return;
        }
        Object lock = lockFor(id);
        synchronized (lock) {
            try {
                Optional<IndexedPlugin> existing = store.findPlugin(id);
                if (existing.isEmpty()) {
                    log.debug("Outcome for unindexed plugin ignored pluginId={}", id);
                    locks.remove(id, lock);
                    return;
                }
                PluginStatistics updated = existing.get().getStatistics().record(success, executionTimeSeconds);
                store.updateStatistics(id, updated);
                log.debug("Plugin outcome recorded pluginId={} success={} usageCount={} successRate={}",
                        id, success, updated.getUsageCount(), updated.getSuccessRate());
            } catch (DiscoveryStoreException e) {
                log.error("Recording outcome failed pluginId={} operation={}: {}", id, e.getOperation(), e.getMessage());
            }
        }
    }

    @Override
    public Optional<IndexedPlugin> find(String pluginId) {
        if (pluginId == null || pluginId.isBlank()) return Optional.empty();
        try {
            return store.findPlugin(pluginId.trim());
        } catch (DiscoveryStoreException e) {
            log.error("Lookup failed pluginId={}: {}", pluginId, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public boolean remove(String pluginId) {
        if (pluginId == null || pluginId.isBlank()) return false;
        String id = pluginId.trim();
        Object lock = lockFor(id);
        synchronized (lock) {
            try {
                boolean removed = store.deletePlugin(id);
                if (removed) log.info("Plugin removed from index pluginId={}", id);
                locks.remove(id, lock);
                return removed;
            } catch (DiscoveryStoreException e) {
                log.error("Remove failed pluginId={}: {}", id, e.getMessage());
                return false;
            }
        }
    }

    private Object lockFor(String pluginId) {
        return locks.computeIfAbsent(pluginId, k -> new Object());
    }

    int lockCount() {
        return locks.size();
    }

    static String normalize(String goalText) {
        return goalText.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }
}
