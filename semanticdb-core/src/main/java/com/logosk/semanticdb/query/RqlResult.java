package com.logosk.semanticdb.query;

import java.util.List;
import java.util.Set;

/**
 * Typed outcome of an executed {@link RqlQuery}; one record per query type.
 */
public interface RqlResult {

    QueryType type();

    record PhiResonance(String intention,
                        String context,
                        List<String> keywords,
                        List<String> relevantEntities,
                        String insight,
                        double coherenceAtQuery) implements RqlResult {

        @Override
        public QueryType type() {
            return QueryType.PHI;
        }
    }

    /**
     * @param pathsFound number of paths above the threshold, which may exceed {@code paths.size()}
     */
    record SemanticPaths(String from,
                         String to,
                         List<PathMatch> paths,
                         int pathsFound,
                         double minCoherence) implements RqlResult {

        @Override
        public QueryType type() {
            return QueryType.PATH;
        }
    }

    record PathMatch(List<String> nodes, List<Double> hopConfidences, double meanConfidence) {
    }

    record Exploration(String entity, boolean found, Set<String> neighbors, int depth) implements RqlResult {

        @Override
        public QueryType type() {
            return QueryType.EXPLORE;
        }
    }

    record ContextSearch(String keyword, List<ContextMatch> matches, int matchCount) implements RqlResult {

        @Override
        public QueryType type() {
            return QueryType.CONTEXT;
        }
    }

    /**
     * Either an entity hit ({@code entity} set) or a relation hit (endpoints and meaning set).
     */
    record ContextMatch(MatchKind kind, String entity, String source, String target, String meaning) {

        public enum MatchKind { ENTITY, RELATION }

        static ContextMatch ofEntity(String id) {
            return new ContextMatch(MatchKind.ENTITY, id, null, null, null);
        }

        static ContextMatch ofRelation(String source, String target, String meaning) {
            return new ContextMatch(MatchKind.RELATION, null, source, target, meaning);
        }
    }
}
