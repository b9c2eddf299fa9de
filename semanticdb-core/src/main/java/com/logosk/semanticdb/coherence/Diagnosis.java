package com.logosk.semanticdb.coherence;

import java.time.Instant;
import java.util.List;

public record Diagnosis(CoherenceReport coherence,
                        List<TensionFinding> tensions,
                        CoherenceTrend trend,
                        List<String> recommendations,
                        Instant timestamp) {

    public Diagnosis {
        tensions = List.copyOf(tensions);
        recommendations = List.copyOf(recommendations);
    }
}
