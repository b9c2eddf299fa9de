package com.logosk.semanticdb.dreaming;

import com.logosk.semanticdb.core.EdgeRecord;
import com.logosk.semanticdb.core.GraphStore;
import com.logosk.semanticdb.core.GraphTopology;
import com.logosk.semanticdb.exceptions.InvalidAcceptanceException;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Link prediction over a {@link GraphStore}. Produces suggested records with three
 * heuristics (structural holes, neighbour similarity, path completion) and feeds the ones
 * a caller accepts back into the store. Suggestions are never inserted on their own.
 */
public class DreamingEngine {

    private static final Logger LOG = Logger.getLogger(DreamingEngine.class);

    public static final String ACCEPTED_CONTEXT = "dream_accepted";
    private static final double STRUCTURAL_HOLE_TENSION = 0.1;
    private static final double INFERRED_TENSION = 0.05;
    private static final int MIN_NODES = 3;

    public record Settings(double structuralHoleThreshold,
                           double similarityThreshold,
                           double pathCompletionThreshold,
                           double defaultHopConfidence,
                           int maxSuggestions) {

        public static final Settings DEFAULTS = new Settings(0.4, 0.3, 0.5, 0.7, 10);
    }

    private final GraphStore store;
    private final Clock clock;
    private final Settings settings;
    private long totalSuggestions;
    private Instant lastRun;

    public DreamingEngine(GraphStore store) {
        this(store, store.clock(), Settings.DEFAULTS);
    }

    public DreamingEngine(GraphStore store, Clock clock, Settings settings) {
        this.store = store;
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.settings = settings != null ? settings : Settings.DEFAULTS;
    }

    public List<EdgeRecord> generateSuggestions() {
        return generateSuggestions(settings.maxSuggestions());
    }

    /**
     * Runs the strategies in order until {@code maxSuggestions} records are collected.
     * No pair is proposed twice and no pair that already has an edge in either direction
     * is proposed at all.
     */
    public List<EdgeRecord> generateSuggestions(int maxSuggestions) {
        Collector collector = new Collector(Math.max(0, maxSuggestions));
        GraphTopology topology = store.topology();

        structuralHoles(collector);
        neighborSimilarity(collector, topology);
        pathCompletion(collector, topology);

        synchronized (this) {
            totalSuggestions += collector.out.size();
            lastRun = clock.instant();
        }
        LOG.infof("Dreaming produced %d suggestion(s)", collector.out.size());
        return collector.out;
    }

    private void structuralHoles(Collector collector) {
        for (String broker : store.nodeIds()) {
            if (collector.full()) {
                return;
            }
            List<String> successors = new ArrayList<>(store.successors(broker));
            successors.remove(broker);
            if (successors.size() < 2) {
                continue;
            }
            int total = 0;
            int connected = 0;
            for (int i = 0; i < successors.size(); i++) {
                for (int j = i + 1; j < successors.size(); j++) {
                    total++;
                    if (store.hasEdgeEitherDirection(successors.get(i), successors.get(j))) {
                        connected++;
                    }
                }
            }
            double score = 1.0 - (double) connected / total;
            if (score <= settings.structuralHoleThreshold()) {
                continue;
            }
            for (int i = 0; i < successors.size() && !collector.full(); i++) {
                for (int j = i + 1; j < successors.size() && !collector.full(); j++) {
                    collector.offer(successors.get(i), successors.get(j), "structural hole via " + broker,
                            score, STRUCTURAL_HOLE_TENSION);
                }
            }
        }
    }

    private void neighborSimilarity(Collector collector, GraphTopology topology) {
        List<String> ids = store.nodeIds();
        for (int i = 0; i < ids.size() && !collector.full(); i++) {
            for (int j = i + 1; j < ids.size() && !collector.full(); j++) {
                String a = ids.get(i);
                String b = ids.get(j);
                if (!collector.eligible(a, b)) {
                    continue;
                }
                double similarity = topology.jaccard(a, b);
                if (similarity > settings.similarityThreshold()) {
                    collector.offer(a, b, String.format(Locale.ROOT, "neighbor similarity (J=%.2f)", similarity),
                            similarity, INFERRED_TENSION);
                }
            }
        }
    }

    private void pathCompletion(Collector collector, GraphTopology topology) {
        for (String start : store.nodeIds()) {
            for (String mid : store.successors(start)) {
                for (String end : store.successors(mid)) {
                    if (collector.full()) {
                        return;
                    }
                    if (start.equals(end) || !collector.eligible(start, end)) {
                        continue;
                    }
                    double first = topology.strongestConfidence(start, mid).orElse(settings.defaultHopConfidence());
                    double second = topology.strongestConfidence(mid, end).orElse(settings.defaultHopConfidence());
                    double confidence = (first + second) / 2.0;
                    if (confidence > settings.pathCompletionThreshold()) {
                        collector.offer(start, end, "path completion via " + mid, confidence, INFERRED_TENSION);
                    }
                }
            }
        }
    }

    public String acceptSuggestion(EdgeRecord suggestion) {
        return acceptSuggestion(suggestion, ACCEPTED_CONTEXT);
    }

    /**
     * Confirms a suggestion and inserts it through the regular merge and conflict rules.
     *
     * @return the id under which the store now holds the relation
     * @throws InvalidAcceptanceException if the record is not a pending suggestion
     */
    public String acceptSuggestion(EdgeRecord suggestion, String contextId) {
        if (suggestion == null || !suggestion.isSuggested()) {
            throw new InvalidAcceptanceException(suggestion != null ? suggestion.getId() : null);
        }
        String id = store.addEdge(suggestion.asAccepted(), contextId, true);
        LOG.infof("Accepted suggestion %s→%s as %s", suggestion.getSource(), suggestion.getTarget(), id);
        return id;
    }

    public synchronized DreamingStats stats() {
        int nodes = store.nodeCount();
        return new DreamingStats(totalSuggestions, lastRun, nodes, store.edgeCount(),
                nodes >= MIN_NODES ? DreamingStats.READY : DreamingStats.WAITING);
    }

    private final class Collector {
        private final int limit;
        private final List<EdgeRecord> out = new ArrayList<>();
        private final Set<Set<String>> processed = new HashSet<>();

        Collector(int limit) {
            this.limit = limit;
        }

        boolean full() {
            return out.size() >= limit;
        }

        boolean eligible(String a, String b) {
            return !a.equals(b) && !processed.contains(Set.of(a, b)) && !store.hasEdgeEitherDirection(a, b);
        }

        void offer(String a, String b, String description, double confidence, double tension) {
            if (full() || !eligible(a, b)) {
                return;
            }
            processed.add(Set.of(a, b));
            out.add(EdgeRecord.hypothesis(a, b, description, confidence, tension, clock));
        }
    }
}
