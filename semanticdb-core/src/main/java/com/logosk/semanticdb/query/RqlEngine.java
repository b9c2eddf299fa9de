package com.logosk.semanticdb.query;

import com.logosk.semanticdb.coherence.CoherenceEngine;
import com.logosk.semanticdb.core.EdgeRecord;
import com.logosk.semanticdb.core.GraphStore;
import com.logosk.semanticdb.core.GraphTopology;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Executes parsed RQL queries against a {@link GraphStore}. Φ queries also read the
 * current global score from the {@link CoherenceEngine}.
 */
public class RqlEngine {

    private static final Logger LOG = Logger.getLogger(RqlEngine.class);

    static final int MAX_KEYWORDS = 10;
    static final int MAX_PATHS = 5;
    static final int MAX_CONTEXT_MATCHES = 10;
    private static final int PREVIEW_ENTITIES = 3;
    private static final Pattern WORD = Pattern.compile("\\w+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Set<String> STOP_WORDS = Set.of(
            "what", "when", "where", "which", "with", "that", "this", "from", "into", "about", "there",
            "their", "these", "those", "have", "will", "would", "could", "should", "then", "than", "also",
            "что", "как", "почему", "где", "когда", "это", "для", "или", "чтобы", "если", "только");

    private final GraphStore store;
    private final CoherenceEngine coherence;
    private final RqlParser parser = new RqlParser();

    public RqlEngine(GraphStore store, CoherenceEngine coherence) {
        this.store = store;
        this.coherence = coherence;
    }

    public RqlResult run(String text) {
        return execute(parser.parse(text));
    }

    public RqlResult execute(RqlQuery query) {
        LOG.debugf("Executing %s query", query.type());
        if (query instanceof RqlQuery.PhiQuery phi) {
            return phiResonance(phi);
        } else if (query instanceof RqlQuery.PathQuery path) {
            return semanticPaths(path);
        } else if (query instanceof RqlQuery.ExploreQuery explore) {
            return explore(explore);
        } else if (query instanceof RqlQuery.ContextQuery context) {
            return contextSearch(context);
        }
        throw new IllegalArgumentException("Unsupported query implementation: " + query.getClass().getName());
    }

    private RqlResult.PhiResonance phiResonance(RqlQuery.PhiQuery query) {
        List<String> keywords = extractKeywords(query.intention());
        List<String> relevant = new ArrayList<>();
        for (String id : store.nodeIds()) {
            String lower = id.toLowerCase(Locale.ROOT);
            if (keywords.stream().anyMatch(lower::contains)) {
                relevant.add(id);
            }
        }
        StringBuilder insight = new StringBuilder()
                .append("Φ-resonance: intention '").append(query.intention())
                .append("' activates ").append(relevant.size()).append(" entit")
                .append(relevant.size() == 1 ? "y." : "ies.");
        if (!relevant.isEmpty()) {
            insight.append(" Nearest: ")
                    .append(String.join(", ", relevant.subList(0, Math.min(PREVIEW_ENTITIES, relevant.size()))))
                    .append('.');
        }
        double score = coherence.calculateGlobalCoherence().global();
        return new RqlResult.PhiResonance(query.intention(), query.context(), keywords, relevant,
                insight.toString(), score);
    }

    /**
     * Unique lower-cased words longer than three characters that are not stop-words, in
     * order of first appearance, at most {@value #MAX_KEYWORDS}.
     */
    static List<String> extractKeywords(String text) {
        Set<String> keywords = new LinkedHashSet<>();
        if (text == null) {
            return List.of();
        }
        Matcher m = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (m.find() && keywords.size() < MAX_KEYWORDS) {
            String word = m.group();
            if (word.length() > 3 && !STOP_WORDS.contains(word)) {
                keywords.add(word);
            }
        }
        return List.copyOf(keywords);
    }

    private RqlResult.SemanticPaths semanticPaths(RqlQuery.PathQuery query) {
        List<RqlResult.PathMatch> accepted = new ArrayList<>();
        if (store.hasNode(query.from()) && store.hasNode(query.to()) && !query.from().equals(query.to())) {
            GraphTopology topology = store.topology();
            List<String> path = new ArrayList<>();
            path.add(query.from());
            walk(query, topology, path, new LinkedHashSet<>(path), accepted);
        }
        List<RqlResult.PathMatch> shown = List.copyOf(accepted.subList(0, Math.min(MAX_PATHS, accepted.size())));
        return new RqlResult.SemanticPaths(query.from(), query.to(), shown, accepted.size(), query.minCoherence());
    }

    private void walk(RqlQuery.PathQuery query, GraphTopology topology, List<String> path, Set<String> onPath,
                      List<RqlResult.PathMatch> accepted) {
        String last = path.get(path.size() - 1);
        for (String next : store.successors(last)) {
            if (next.equals(query.to())) {
                path.add(next);
                score(path, topology).filter(m -> m.meanConfidence() >= query.minCoherence()).ifPresent(accepted::add);
                path.remove(path.size() - 1);
            } else if (path.size() < query.maxLength() && !onPath.contains(next)) {
                path.add(next);
                onPath.add(next);
                walk(query, topology, path, onPath, accepted);
                onPath.remove(next);
                path.remove(path.size() - 1);
            }
        }
    }

    private static Optional<RqlResult.PathMatch> score(List<String> path, GraphTopology topology) {
        List<Double> hops = new ArrayList<>();
        for (int i = 0; i + 1 < path.size(); i++) {
            hops.add(topology.strongestConfidence(path.get(i), path.get(i + 1)).orElse(0.0));
        }
        if (hops.isEmpty()) {
            return Optional.empty();
        }
        double mean = hops.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        return Optional.of(new RqlResult.PathMatch(List.copyOf(path), List.copyOf(hops), mean));
    }

    private RqlResult.Exploration explore(RqlQuery.ExploreQuery query) {
        if (!store.hasNode(query.entity())) {
            return new RqlResult.Exploration(query.entity(), false, Set.of(), query.depth());
        }
        Set<String> neighbors = new LinkedHashSet<>(store.successors(query.entity()));
        if (query.depth() > 1) {
            Set<String> second = new LinkedHashSet<>();
            for (String n : neighbors) {
                second.addAll(store.successors(n));
            }
            second.remove(query.entity());
            neighbors.addAll(second);
        }
        return new RqlResult.Exploration(query.entity(), true, Set.copyOf(neighbors), query.depth());
    }

    private RqlResult.ContextSearch contextSearch(RqlQuery.ContextQuery query) {
        String needle = query.keyword().toLowerCase(Locale.ROOT);
        List<RqlResult.ContextMatch> matches = new ArrayList<>();
        for (String id : store.nodeIds()) {
            if (id.toLowerCase(Locale.ROOT).contains(needle)) {
                matches.add(RqlResult.ContextMatch.ofEntity(id));
            }
        }
        for (EdgeRecord r : store.allEdges()) {
            if (r.getMeaning().toLowerCase(Locale.ROOT).contains(needle)) {
                matches.add(RqlResult.ContextMatch.ofRelation(r.getSource(), r.getTarget(), r.getMeaning()));
            }
        }
        return new RqlResult.ContextSearch(query.keyword(),
                List.copyOf(matches.subList(0, Math.min(MAX_CONTEXT_MATCHES, matches.size()))), matches.size());
    }
}
