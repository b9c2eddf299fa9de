package com.logosk.semanticdb.query;

import java.util.List;

/**
 * A parsed RQL expression.
 */
public interface RqlQuery {

    QueryType type();

    record PhiQuery(String intention, String context, List<String> blindSpots, List<String> phiMeta)
            implements RqlQuery {

        public PhiQuery {
            intention = intention != null ? intention : "";
            context = context != null ? context : "";
            blindSpots = blindSpots != null ? List.copyOf(blindSpots) : List.of();
            phiMeta = phiMeta != null ? List.copyOf(phiMeta) : List.of();
        }

        @Override
        public QueryType type() {
            return QueryType.PHI;
        }
    }

    record PathQuery(String from, String to, int maxLength, double minCoherence) implements RqlQuery {

        public static final int DEFAULT_MAX_LENGTH = 3;
        public static final double DEFAULT_MIN_COHERENCE = 0.5;

        @Override
        public QueryType type() {
            return QueryType.PATH;
        }
    }

    record ExploreQuery(String entity, int depth) implements RqlQuery {

        public static final int DEFAULT_DEPTH = 2;

        @Override
        public QueryType type() {
            return QueryType.EXPLORE;
        }
    }

    record ContextQuery(String keyword) implements RqlQuery {

        public ContextQuery {
            keyword = keyword != null ? keyword : "";
        }

        @Override
        public QueryType type() {
            return QueryType.CONTEXT;
        }
    }
}
