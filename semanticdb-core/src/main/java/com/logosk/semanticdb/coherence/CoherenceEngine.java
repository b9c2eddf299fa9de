package com.logosk.semanticdb.coherence;

import com.logosk.semanticdb.core.EdgeRecord;
import com.logosk.semanticdb.core.GraphStore;
import com.logosk.semanticdb.core.GraphTopology;
import com.logosk.semanticdb.util.CommonUtils;
import com.logosk.semanticdb.util.ExceptionLoggingUtils;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Scores and diagnoses the health of a {@link GraphStore}.
 * <p>
 * The engine reads the store on demand and keeps only two bounded logs of its own: the
 * history of global scores and the log of reported tensions. Both are capped at
 * {@link Settings#historyCap()} entries and trimmed to the newest
 * {@link Settings#historyRetain()} on overflow.
 * </p>
 */
public class CoherenceEngine {

    private static final Logger LOG = Logger.getLogger(CoherenceEngine.class);

    static final double HIGH_TENSION = 0.7;
    static final double CONFLICT_CONFIDENCE = 0.6;
    static final double TENSE_CYCLE_THRESHOLD = 0.6;
    static final double TREND_EPSILON = 0.05;
    static final int ISOLATION_RECOMMENDATION_LIMIT = 5;

    public static final String RECOMMEND_BOUNDARY = "Acknowledge a boundary (Ω)";
    public static final String RECOMMEND_CONNECT = "Create connections (Λ) for isolated entities";
    public static final String RECOMMEND_DIALOGUE = "Resolve conflicts via dialogue (Φ)";
    public static final String RECOMMEND_INVARIANT = "Enrich with an invariant (∇)";

    /**
     * Thresholds and budgets of the engine.
     */
    public record Settings(double healthyThreshold,
                           double warningThreshold,
                           double crisisThreshold,
                           int historyCap,
                           int historyRetain,
                           long cycleStepBudget,
                           Duration cycleTimeBudget,
                           int maxCycles) {

        public static final Settings DEFAULTS =
                new Settings(0.7, 0.4, 0.2, 1000, 500, 100_000L, Duration.ofMillis(2000), 10_000);

        public Settings {
            if (historyRetain <= 0 || historyRetain > historyCap) {
                throw new IllegalArgumentException("history-retain must lie in (0, history-cap]");
            }
        }
    }

    public record Sample(Instant timestamp, double score) {
    }

    private final GraphStore store;
    private final Clock clock;
    private final Settings settings;
    private final List<Sample> history = new ArrayList<>();
    private final List<TensionFinding> tensionLog = new ArrayList<>();

    public CoherenceEngine(GraphStore store) {
        this(store, store.clock(), Settings.DEFAULTS);
    }

    public CoherenceEngine(GraphStore store, Clock clock, Settings settings) {
        this.store = store;
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.settings = settings != null ? settings : Settings.DEFAULTS;
    }

    public CoherenceReport calculateGlobalCoherence() {
        Instant now = clock.instant();
        if (store.nodeCount() == 0) {
            CoherenceReport empty = new CoherenceReport(1.0, 1.0, 1.0, 0.0,
                    new CoherenceReport.Metrics(0, 0, 0, 0, 1.0), CoherenceStatus.EMPTY, now);
            appendHistory(new Sample(now, empty.global()));
            return empty;
        }

        GraphTopology topology = store.topology();
        double structural = CommonUtils.clamp01(topology.density() * 0.4
                + (1.0 / Math.max(1, topology.weakComponentCount())) * 0.6);

        List<EdgeRecord> edges = store.allEdges();
        double sum = 0.0;
        int highTension = 0;
        for (EdgeRecord r : edges) {
            sum += r.getConfidence();
            if (r.getTension() > HIGH_TENSION) {
                highTension++;
            }
        }
        double semantic = edges.isEmpty() ? 1.0 : CommonUtils.clamp01(sum / edges.size());
        double penalty = highTension == 0 ? 0.0 : Math.min(1.0, Math.log1p(highTension) / 10.0);
        double global = CommonUtils.clamp01(structural * 0.3 + semantic * 0.5 + (1.0 - penalty) * 0.2);

        CoherenceReport report = new CoherenceReport(global, structural, semantic, penalty,
                new CoherenceReport.Metrics(store.nodeCount(), edges.size(), topology.isolatedCount(), highTension, semantic),
                statusFor(global), now);
        appendHistory(new Sample(now, global));
        LOG.debugf("Coherence %.3f (%s)", global, report.status().label());
        return report;
    }

    CoherenceStatus statusFor(double score) {
        if (score >= settings.healthyThreshold()) {
            return CoherenceStatus.HEALTHY;
        } else if (score >= settings.warningThreshold()) {
            return CoherenceStatus.WARNING;
        } else if (score >= settings.crisisThreshold()) {
            return CoherenceStatus.CRISIS;
        }
        return CoherenceStatus.COLLAPSE;
    }

    /**
     * Runs the meaning-conflict, tense-cycle and isolation checks, in that order, and
     * appends the findings to the tension log.
     */
    public List<TensionFinding> detectTensions() {
        List<TensionFinding> findings = new ArrayList<>(meaningConflicts());
        findings.addAll(tenseCycles());

        int isolated = store.topology().isolatedCount();
        if (isolated > 0) {
            findings.add(TensionFinding.isolation(isolated));
        }

        synchronized (tensionLog) {
            tensionLog.addAll(findings);
            trim(tensionLog);
        }
        return findings;
    }

    private List<TensionFinding> meaningConflicts() {
        List<TensionFinding> out = new ArrayList<>();
        for (String u : store.nodeIds()) {
            for (String v : store.successors(u)) {
                if (u.equals(v)) {
                    continue;
                }
                List<EdgeRecord> pair = store.edgesBetween(u, v);
                for (int i = 0; i < pair.size(); i++) {
                    for (int j = i + 1; j < pair.size(); j++) {
                        EdgeRecord a = pair.get(i);
                        EdgeRecord b = pair.get(j);
                        if (a.getType() == b.getType()
                                && !a.getMeaning().equals(b.getMeaning())
                                && a.getConfidence() > CONFLICT_CONFIDENCE
                                && b.getConfidence() > CONFLICT_CONFIDENCE) {
                            out.add(TensionFinding.meaningConflict(u, v, a.getId(), b.getId()));
                        }
                    }
                }
            }
        }
        return out;
    }

    private List<TensionFinding> tenseCycles() {
        List<TensionFinding> out = new ArrayList<>();
        try {
            Map<String, Set<String>> adjacency = new LinkedHashMap<>();
            for (String id : store.nodeIds()) {
                Set<String> next = new LinkedHashSet<>(store.successors(id));
                next.remove(id);
                adjacency.put(id, next);
            }
            CycleEnumerator enumerator = new CycleEnumerator(settings.cycleStepBudget(),
                    settings.cycleTimeBudget(), settings.maxCycles());
            for (List<String> cycle : enumerator.enumerate(adjacency).cycles()) {
                if (cycle.size() <= 2) {
                    continue;
                }
                double total = 0.0;
                int count = 0;
                for (int i = 0; i < cycle.size(); i++) {
                    for (EdgeRecord r : store.edgesBetween(cycle.get(i), cycle.get((i + 1) % cycle.size()))) {
                        total += r.getTension();
                        count++;
                    }
                }
                if (count > 0 && total / count > TENSE_CYCLE_THRESHOLD) {
                    out.add(TensionFinding.tenseCycle(cycle, total / count));
                }
            }
        } catch (RuntimeException e) {
            ExceptionLoggingUtils.logIgnoredException(LOG, e, "tense cycle detection");
            return List.of();
        }
        return out;
    }

    public CoherenceTrend getCoherenceTrend() {
        return getCoherenceTrend(24);
    }

    public CoherenceTrend getCoherenceTrend(int windowHours) {
        List<Sample> samples = history();
        if (samples.isEmpty()) {
            return new CoherenceTrend(CoherenceTrend.Direction.STABLE, 0.0, 0, null, null, windowHours);
        }
        Instant cutoff = clock.instant().minus(Duration.ofHours(windowHours));
        List<Sample> recent = samples.stream().filter(s -> !s.timestamp().isBefore(cutoff)).toList();
        if (recent.size() < 2) {
            return new CoherenceTrend(CoherenceTrend.Direction.INSUFFICIENT_DATA, 0.0, recent.size(), null, null, windowHours);
        }
        double first = recent.get(0).score();
        double last = recent.get(recent.size() - 1).score();
        double change = last - first;
        CoherenceTrend.Direction direction = change > TREND_EPSILON ? CoherenceTrend.Direction.IMPROVING
                : change < -TREND_EPSILON ? CoherenceTrend.Direction.DEGRADING
                : CoherenceTrend.Direction.STABLE;
        return new CoherenceTrend(direction, change, recent.size(), first, last, windowHours);
    }

    /**
     * Full check-up: score, tensions and trend, plus advisory recommendations.
     */
    public Diagnosis diagnose() {
        CoherenceReport coherence = calculateGlobalCoherence();
        List<TensionFinding> tensions = detectTensions();
        CoherenceTrend trend = getCoherenceTrend();

        List<String> recommendations = new ArrayList<>();
        if (coherence.status().isCritical()) {
            recommendations.add(RECOMMEND_BOUNDARY);
        }
        if (coherence.metrics().isolatedNodes() > ISOLATION_RECOMMENDATION_LIMIT) {
            recommendations.add(RECOMMEND_CONNECT);
        }
        if (tensions.stream().anyMatch(t -> t.severity() == TensionFinding.Severity.HIGH)) {
            recommendations.add(RECOMMEND_DIALOGUE);
        }
        if (trend.trend() == CoherenceTrend.Direction.DEGRADING) {
            recommendations.add(RECOMMEND_INVARIANT);
        }
        LOG.infof("Diagnosis: coherence %.3f, %d tension(s), trend %s", coherence.global(), tensions.size(), trend.trend());
        return new Diagnosis(coherence, tensions, trend, recommendations, clock.instant());
    }

    public List<Sample> history() {
        synchronized (history) {
            return List.copyOf(history);
        }
    }

    public List<TensionFinding> tensionLog() {
        synchronized (tensionLog) {
            return List.copyOf(tensionLog);
        }
    }

    /**
     * Latest global score, 1.0 before the first evaluation.
     */
    public double currentCoherence() {
        synchronized (history) {
            return history.isEmpty() ? 1.0 : history.get(history.size() - 1).score();
        }
    }

    private void appendHistory(Sample sample) {
        synchronized (history) {
            history.add(sample);
            trim(history);
        }
    }

    private <T> void trim(List<T> log) {
        if (log.size() > settings.historyCap()) {
            log.subList(0, log.size() - settings.historyRetain()).clear();
        }
    }
}
