package com.logosk.semanticdb.spi;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The document written at the end of a cycle: metadata, the caller's cycle summary and
 * the full graph state. Field names on disk are snake_case.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExportDocument {

    private Metadata metadata;

    @JsonProperty("cycle_summary")
    @Builder.Default
    private Map<String, Object> cycleSummary = new LinkedHashMap<>();

    @JsonProperty("ontological_context")
    private OntologicalContext ontologicalContext;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class Metadata {
        private String protocol;
        private String version;
        @JsonProperty("operator_id")
        private String operatorId;
        private String timestamp;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class OntologicalContext {
        @Builder.Default
        private Map<String, Map<String, Object>> nodes = new LinkedHashMap<>();
        @Builder.Default
        private List<Map<String, Object>> edges = new ArrayList<>();
        @JsonProperty("conflict_zones")
        @Builder.Default
        private List<String> conflictZones = new ArrayList<>();
        private double coherence;
    }
}
