package com.logosk.semanticdb.coherence;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One evaluation of graph health. All scores lie in [0,1].
 */
public record CoherenceReport(double global,
                              double structural,
                              double semantic,
                              double tensionPenalty,
                              Metrics metrics,
                              CoherenceStatus status,
                              Instant timestamp) {

    public record Metrics(int nodes, int edges, int isolatedNodes, int highTensionRelations, double avgConfidence) {
    }

    public Map<String, Object> toMap() {
        Map<String, Object> metricMap = new LinkedHashMap<>();
        metricMap.put("nodes", metrics.nodes());
        metricMap.put("edges", metrics.edges());
        metricMap.put("isolated_nodes", metrics.isolatedNodes());
        metricMap.put("high_tension_relations", metrics.highTensionRelations());
        metricMap.put("avg_confidence", metrics.avgConfidence());

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("global", global);
        out.put("structural", structural);
        out.put("semantic", semantic);
        out.put("tension_penalty", tensionPenalty);
        out.put("metrics", metricMap);
        out.put("status", status.label());
        out.put("timestamp", timestamp.toString());
        return out;
    }
}
