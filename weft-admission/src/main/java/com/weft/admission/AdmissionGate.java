package com.weft.admission;

import com.weft.config.WeftConfig;
import com.weft.plugin.PluginDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Confidence ledger and execution veto for plugins. Each plugin has one ledger, created on first
 * scoring or first recorded execution; updates to one ledger are serialized on that ledger, so
 * unrelated plugins never contend. Decisions are re-evaluated on every attempt and never cached.
 * <p>
 * Advisory: apart from null or blank identities, no method throws. Analyzer and listener failures
 * are logged.
 */
public final class AdmissionGate {

    private static final Logger log = LoggerFactory.getLogger(AdmissionGate.class);

    /** Below this confidence a plugin is blocked even with a user override. */
    public static final double CONFIDENCE_FLOOR = 0.3;
    /** Below this confidence an admitted plugin is flagged WARNED. */
    public static final double WARNING_THRESHOLD = 0.6;
    public static final int MAX_ALTERNATIVES = 5;

    private static final double SLOW_EXECUTION_SECONDS = 3.0;
    private static final double UNRELIABLE_ERROR_FREQUENCY = 0.2;
    private static final double PERFORMANCE_HORIZON_SECONDS = 10.0;
    static final int RECENT_EXECUTIONS = 10;
    static final int COMMON_ERRORS = 3;

    private final int errorWindow;
    private final Map<String, PluginLedger> ledgers = new ConcurrentHashMap<>();
    private final List<AdmissionListener> listeners = new CopyOnWriteArrayList<>();

    public AdmissionGate() {
        this(WeftConfig.DEFAULT_ADMISSION_ERROR_WINDOW);
    }

    public AdmissionGate(WeftConfig config) {
        this(Objects.requireNonNull(config, "WeftConfig").getAdmissionErrorWindow());
    }

    /**
     * @param errorWindow number of most recent executions over which error frequency is computed
     */
    public AdmissionGate(int errorWindow) {
        this.errorWindow = errorWindow > 0 ? errorWindow : WeftConfig.DEFAULT_ADMISSION_ERROR_WINDOW;
    }

    /**
     * Pure veto rule. Blocks when confidence is under {@value #CONFIDENCE_FLOOR} whatever the override,
     * and when risk is HIGH or CRITICAL without override.
     */
    public static boolean shouldBlock(RiskLevel riskLevel, double confidenceScore, boolean userOverride) {
        if (confidenceScore < CONFIDENCE_FLOOR) {
            return true;
        }
        return riskLevel != null && riskLevel.isBlocking() && !userOverride;
    }

    public void addListener(AdmissionListener listener) {
        if (listener != null) listeners.add(listener);
    }

    public void removeListener(AdmissionListener listener) {
        listeners.remove(listener);
    }

    /**
     * Records a static analysis result: UNSCORED → SCORED, or re-scoring. Until the plugin has run,
     * its confidence equals the analysis score; afterwards runtime metrics are blended in.
     */
    public ConfidenceRecord score(String pluginId, StaticAnalysis analysis) {
        Objects.requireNonNull(analysis, "analysis");
        PluginLedger ledger = ledgerFor(pluginId);
        synchronized (ledger) {
            ledger.applyAnalysis(analysis);
            ConfidenceRecord snapshot = ledger.snapshot();
            log.info("Plugin scored pluginId={} confidence={} risk={} baseline={}",
                    snapshot.getPluginId(), format(snapshot.getConfidenceScore()), snapshot.getRiskLevel(),
                    format(snapshot.getBaselineScore()));
            return snapshot;
        }
    }

    /**
     * Runs the analyzer for the descriptor and records its result. Empty when the analyzer failed.
     */
    public Optional<ConfidenceRecord> score(PluginDescriptor descriptor, StaticAnalyzer analyzer) {
        Objects.requireNonNull(descriptor, "descriptor");
        Objects.requireNonNull(analyzer, "analyzer");
        StaticAnalysis analysis;
        try {
            analysis = analyzer.analyze(descriptor);
        } catch (RuntimeException e) {
            log.error("Static analysis failed pluginId={}: {}", descriptor.getIdentity(), e.getMessage(), e);
            return Optional.empty();
        }
        if (analysis == null) {
            log.warn("Static analysis returned nothing pluginId={}", descriptor.getIdentity());
            return Optional.empty();
        }
        return Optional.of(score(descriptor.getIdentity(), analysis));
    }

    /** Evaluates without user override. */
    public AdmissionDecision evaluate(String pluginId) {
        return evaluate(pluginId, false);
    }

    /**
     * Decides whether the plugin may execute now. Unscored plugins are permitted (state UNSCORED):
     * the analyzer may not have run yet. WARNED notifies listeners' {@code onWarning}; BLOCKED notifies
     * {@code onBlocked} and carries alternatives.
     */
    public AdmissionDecision evaluate(String pluginId, boolean userOverride) {
        String id = requireId(pluginId);
        PluginLedger ledger = ledgers.get(id);
        ConfidenceRecord record = null;
        if (ledger != null) {
            synchronized (ledger) {
                record = ledger.snapshot();
            }
        }
        if (record == null || !record.isScored()) {
            log.debug("Plugin not scored yet; admitting pluginId={}", id);
            return new AdmissionDecision(id, AdmissionState.UNSCORED, null, Double.NaN, null, List.of());
        }
        double confidence = record.getConfidenceScore();
        RiskLevel risk = record.getRiskLevel();
        if (shouldBlock(risk, confidence, userOverride)) {
            String cause = confidence < CONFIDENCE_FLOOR ? "low confidence"
                    : risk.name().toLowerCase(Locale.ROOT) + " risk";
            String message = String.format(Locale.ROOT, "Plugin '%s' blocked due to %s (confidence: %s)",
                    id, cause, percent(confidence));
            AdmissionDecision decision = new AdmissionDecision(id, AdmissionState.BLOCKED, risk, confidence,
                    message, recommendAlternatives(id));
            log.warn("Plugin blocked pluginId={} risk={} confidence={} override={} alternatives={}",
                    id, risk, format(confidence), userOverride, decision.getAlternatives().size());
            notifyBlocked(decision);
            return decision;
        }
        if (confidence < WARNING_THRESHOLD) {
            String message = warningFor(id, confidence, risk);
            if (message == null) {
                message = String.format(Locale.ROOT, "Plugin '%s' has low confidence (%s).", id, percent(confidence));
            }
            log.info("Plugin admitted with warning pluginId={} confidence={}", id, format(confidence));
            notifyWarning(id, message, record);
            return new AdmissionDecision(id, AdmissionState.WARNED, risk, confidence, message, List.of());
        }
        return new AdmissionDecision(id, AdmissionState.ALLOWED, risk, confidence, null, List.of());
    }

    /**
     * Folds one execution into the plugin's ledger: cumulative average time, cumulative success rate,
     * rolling error frequency, usage count, last error, error-type counts and the timing samples behind
     * the performance trend; then recomputes confidence as
     * {@code 0.4*baseline + 0.3*successRate + 0.2*performance + 0.1*(1-errorFrequency)}. An unknown
     * plugin gets an unscored ledger that records metrics only.
     */
    public void recordExecution(String pluginId, double executionTimeSeconds, boolean success, ExecutionErrorInfo errorInfo) {
        PluginLedger ledger = ledgerFor(pluginId);
        synchronized (ledger) {
            ledger.recordExecution(executionTimeSeconds, success, errorInfo, errorWindow);
            log.debug("Execution recorded pluginId={} success={} seconds={} usage={} errorFrequency={} confidence={}",
                    ledger.pluginId, success, format(executionTimeSeconds), ledger.usageCount,
                    format(ledger.errorFrequency()), format(ledger.confidence));
        }
    }

    /**
     * Other scored plugins with strictly higher confidence and a non-blocking risk level, best first,
     * at most {@value #MAX_ALTERNATIVES}. Empty when the plugin is unknown or unscored.
     */
    public List<ConfidenceRecord> recommendAlternatives(String pluginId) {
        String id = requireId(pluginId);
        Optional<ConfidenceRecord> current = snapshot(id);
        if (current.isEmpty() || !current.get().isScored()) {
            return List.of();
        }
        double threshold = current.get().getConfidenceScore();
        List<ConfidenceRecord> out = new ArrayList<>();
        for (ConfidenceRecord r : all()) {
            if (r.getPluginId().equals(id) || !r.isScored()) continue;
            if (r.getConfidenceScore() <= threshold) continue;
            if (shouldBlock(r.getRiskLevel(), r.getConfidenceScore(), false)) continue;
            out.add(r);
        }
        out.sort(Comparator.comparingDouble(ConfidenceRecord::getConfidenceScore).reversed()
                .thenComparing(ConfidenceRecord::getPluginId));
        return out.size() > MAX_ALTERNATIVES ? List.copyOf(out.subList(0, MAX_ALTERNATIVES)) : out;
    }

    /**
     * User-facing warning for a confidence/risk pair, or null when there is nothing to warn about.
     */
    public static String warningFor(String pluginId, double confidenceScore, RiskLevel riskLevel) {
        if (riskLevel == RiskLevel.CRITICAL) {
            return "Plugin '" + pluginId + "' has critical safety issues. Execution blocked for your protection.";
        }
        if (riskLevel == RiskLevel.HIGH) {
            return "Plugin '" + pluginId + "' has high risk (confidence: " + percent(confidenceScore) + "). Proceed with caution.";
        }
        if (confidenceScore < 0.5) {
            return "Plugin '" + pluginId + "' has low confidence (" + percent(confidenceScore) + "). Consider alternatives or improvements.";
        }
        if (confidenceScore < 0.7) {
            return "Plugin '" + pluginId + "' has moderate confidence (" + percent(confidenceScore) + "). May need optimization.";
        }
        return null;
    }

    /** Improvement advice derived from the plugin's ledger; NO_DATA when it is unknown or unscored. */
    public List<Recommendation> improvementRecommendations(String pluginId) {
        Optional<ConfidenceRecord> snapshot = snapshot(requireId(pluginId));
        if (snapshot.isEmpty() || !snapshot.get().isScored()) {
            return List.of(new Recommendation(Recommendation.Type.NO_DATA, Recommendation.Priority.LOW,
                    "No confidence data available for this plugin", List.of()));
        }
        ConfidenceRecord r = snapshot.get();
        List<Recommendation> out = new ArrayList<>();
        if (r.getConfidenceScore() < 0.5) {
            out.add(new Recommendation(Recommendation.Type.LOW_CONFIDENCE, Recommendation.Priority.HIGH,
                    "Plugin has low confidence score (" + percent(r.getConfidenceScore()) + ")",
                    List.of("Review plugin code for safety issues", "Improve error handling",
                            "Add input validation", "Consider rewriting plugin")));
        }
        if (r.getAverageExecutionTime() > SLOW_EXECUTION_SECONDS) {
            out.add(new Recommendation(Recommendation.Type.PERFORMANCE, Recommendation.Priority.MEDIUM,
                    String.format(Locale.ROOT, "Plugin is slow (avg: %.2fs)", r.getAverageExecutionTime()),
                    List.of("Profile code for bottlenecks", "Optimize algorithms", "Add caching",
                            "Use async operations")));
        }
        if (r.getErrorFrequency() > UNRELIABLE_ERROR_FREQUENCY) {
            out.add(new Recommendation(Recommendation.Type.RELIABILITY, Recommendation.Priority.HIGH,
                    "Plugin fails frequently (" + percent(r.getErrorFrequency()) + " error rate)",
                    List.of("Add comprehensive error handling", "Improve input validation",
                            "Add logging and debugging", "Write unit tests")));
        }
        if (r.getRiskLevel() != null && r.getRiskLevel().isBlocking()) {
            out.add(new Recommendation(Recommendation.Type.SAFETY, Recommendation.Priority.CRITICAL,
                    "Plugin has " + r.getRiskLevel().name().toLowerCase(Locale.ROOT) + " safety risk",
                    List.of("Remove unsafe imports", "Eliminate dynamic code execution",
                            "Add input sanitization", "Review security implications")));
        }
        return out;
    }

    /** Aggregate over scored plugins. */
    public ConfidenceSummary summary() {
        List<ConfidenceRecord> scored = new ArrayList<>();
        for (ConfidenceRecord r : all()) {
            if (r.isScored()) scored.add(r);
        }
        if (scored.isEmpty()) {
            return new ConfidenceSummary(0, 0.0, 0, 0, 0, 0, List.of());
        }
        double sum = 0.0;
        int high = 0;
        int medium = 0;
        int low = 0;
        int blocking = 0;
        for (ConfidenceRecord r : scored) {
            double c = r.getConfidenceScore();
            sum += c;
            if (c >= 0.8) high++;
            else if (c >= 0.5) medium++;
            else low++;
            if (r.getRiskLevel().isBlocking()) blocking++;
        }
        return new ConfidenceSummary(scored.size(), sum / scored.size(), high, medium, low, blocking, scored);
    }

    public Optional<ConfidenceRecord> snapshot(String pluginId) {
        if (pluginId == null || pluginId.isBlank()) return Optional.empty();
        PluginLedger ledger = ledgers.get(pluginId.trim());
        if (ledger == null) return Optional.empty();
        synchronized (ledger) {
            return Optional.of(ledger.snapshot());
        }
    }

    /** Snapshots of every ledger, ordered by plugin identity. */
    public List<ConfidenceRecord> all() {
        List<ConfidenceRecord> out = new ArrayList<>(ledgers.size());
        for (PluginLedger ledger : ledgers.values()) {
            synchronized (ledger) {
                out.add(ledger.snapshot());
            }
        }
        out.sort(Comparator.comparing(ConfidenceRecord::getPluginId));
        return out;
    }

    private void notifyWarning(String pluginId, String message, ConfidenceRecord record) {
        for (AdmissionListener l : listeners) {
            try {
                l.onWarning(pluginId, message, record);
            } catch (RuntimeException e) {
                log.warn("Admission listener failed onWarning pluginId={}: {}", pluginId, e.getMessage(), e);
            }
        }
    }

    private void notifyBlocked(AdmissionDecision decision) {
        for (AdmissionListener l : listeners) {
            try {
                l.onBlocked(decision);
            } catch (RuntimeException e) {
                log.warn("Admission listener failed onBlocked pluginId={}: {}", decision.getPluginId(), e.getMessage(), e);
            }
        }
    }

    private PluginLedger ledgerFor(String pluginId) {
        return ledgers.computeIfAbsent(requireId(pluginId), PluginLedger::new);
    }

    private static String requireId(String pluginId) {
        if (pluginId == null || pluginId.isBlank()) {
            throw new IllegalArgumentException("pluginId must be non-blank");
        }
        return pluginId.trim();
    }

    static double clamp(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.max(0.0, Math.min(1.0, v));
    }

    private static String percent(double fraction) {
        return String.format(Locale.ROOT, "%.1f%%", fraction * 100.0);
    }

    private static String format(double v) {
        return String.format(Locale.ROOT, "%.3f", v);
    }

    /** Mutable per-plugin state; guarded by its own monitor. */
    private static final class PluginLedger {
        private final String pluginId;
        private boolean scored;
        private double baseline;
        private double confidence;
        private RiskLevel risk;
        private List<String> recommendations = List.of();
        private long usageCount;
        private long successCount;
        private double averageExecutionTime;
        private final Deque<Boolean> recentFailures = new ArrayDeque<>();
        private final Deque<Double> recentTimes = new ArrayDeque<>();
        private final Map<String, Long> errorTypes = new HashMap<>();
        private ExecutionErrorInfo lastError;
        private Instant lastUpdated = Instant.now();

        PluginLedger(String pluginId) {
            this.pluginId = pluginId;
        }

        void applyAnalysis(StaticAnalysis analysis) {
            scored = true;
            baseline = analysis.getConfidenceScore();
            risk = analysis.getRiskLevel();
            recommendations = analysis.getRecommendations();
            recompute();
        }

        void recordExecution(double seconds, boolean success, ExecutionErrorInfo errorInfo, int window) {
            double t = Double.isNaN(seconds) ? 0.0 : Math.max(0.0, seconds);
            averageExecutionTime = (averageExecutionTime * usageCount + t) / (usageCount + 1);
            usageCount++;
            if (success) {
                successCount++;
            } else {
                lastError = errorInfo;
                if (errorInfo != null && errorInfo.type() != null) {
                    errorTypes.merge(errorInfo.type(), 1L, Long::sum);
                }
            }
            recentFailures.addLast(!success);
            while (recentFailures.size() > window) {
                recentFailures.removeFirst();
            }
            recentTimes.addLast(t);
            while (recentTimes.size() > Math.max(window, RECENT_EXECUTIONS)) {
                recentTimes.removeFirst();
            }
            recompute();
        }

        double successRate() {
            return usageCount == 0 ? 0.0 : (double) successCount / usageCount;
        }

        double errorFrequency() {
            if (recentFailures.isEmpty()) return 0.0;
            int failures = 0;
            for (Boolean f : recentFailures) {
                if (f) failures++;
            }
            return (double) failures / recentFailures.size();
        }

        private void recompute() {
            lastUpdated = Instant.now();
            if (!scored) return;
            if (usageCount == 0) {
                confidence = baseline;
                return;
            }
            double performance = clamp((PERFORMANCE_HORIZON_SECONDS - averageExecutionTime) / PERFORMANCE_HORIZON_SECONDS);
            confidence = clamp(0.4 * baseline + 0.3 * successRate() + 0.2 * performance + 0.1 * (1.0 - errorFrequency()));
        }

        List<Double> newestTimes() {
            List<Double> out = new ArrayList<>(RECENT_EXECUTIONS);
            Iterator<Double> it = recentTimes.descendingIterator();
            while (it.hasNext() && out.size() < RECENT_EXECUTIONS) {
                out.add(it.next());
            }
            return out;
        }

        Map<String, Long> commonErrors() {
            List<Map.Entry<String, Long>> entries = new ArrayList<>(errorTypes.entrySet());
            entries.sort(Map.Entry.<String, Long>comparingByValue().reversed()
                    .thenComparing(Map.Entry.comparingByKey()));
            Map<String, Long> out = new LinkedHashMap<>();
            for (Map.Entry<String, Long> e : entries) {
                if (out.size() == COMMON_ERRORS) break;
                out.put(e.getKey(), e.getValue());
            }
            return out;
        }

        ConfidenceRecord snapshot() {
            return new ConfidenceRecord(pluginId, scored, scored ? confidence : 0.0, baseline, risk,
                    averageExecutionTime, errorFrequency(), usageCount, successRate(), recommendations,
                    lastError, lastUpdated, PerformanceTrend.of(new ArrayList<>(recentTimes)), commonErrors(),
                    newestTimes());
        }
    }
}
