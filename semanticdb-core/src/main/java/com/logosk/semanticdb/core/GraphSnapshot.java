package com.logosk.semanticdb.core;

import java.util.List;
import java.util.Map;

/**
 * Serialisable image of a whole graph: every node's attribute map and every edge
 * record's document form (see {@link EdgeRecord#toDocument()}).
 */
public record GraphSnapshot(Map<String, Object> metadata,
                            Map<String, Map<String, Object>> nodes,
                            List<Map<String, Object>> edges) {

    public GraphSnapshot {
        metadata = metadata != null ? metadata : Map.of();
        nodes = nodes != null ? nodes : Map.of();
        edges = edges != null ? edges : List.of();
    }
}
