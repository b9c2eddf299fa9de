package com.logosk.semanticdb.spi;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One recorded gesture: what was done, by whom, to which entities and how it moved
 * the global coherence score.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OntologicalEvent {

    private String id;
    private Instant timestamp;

    /**
     * Symbol of the relation kind used as gesture, e.g. {@code Λ}.
     */
    private String gesture;
    private String operatorId;
    @Builder.Default
    private List<String> operands = new ArrayList<>();
    private String result;
    @Builder.Default
    private List<String> affectedEntities = new ArrayList<>();
    @Builder.Default
    private List<String> blindSpots = new ArrayList<>();
    private double coherenceBefore;
    private double coherenceAfter;
    private double tensionLevel;
    private double significance;
    @Builder.Default
    private Map<String, Object> ethicsMetadata = new LinkedHashMap<>();
    private String weightId;
}
