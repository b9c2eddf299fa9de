package com.logosk.semanticdb.dreaming;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

public record DreamingStats(long totalSuggestions, Instant lastRun, int nodes, int edges, String status) {

    public static final String READY = "ready";
    public static final String WAITING = "waiting_for_data";

    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("total_suggestions", totalSuggestions);
        out.put("last_dreaming", lastRun != null ? lastRun.toString() : null);
        out.put("graph_size", Map.of("nodes", nodes, "edges", edges));
        out.put("status", status);
        return out;
    }
}
