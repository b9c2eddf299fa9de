package com.logosk.semanticdb.coherence;

import java.util.List;

/**
 * A single problem reported by {@link CoherenceEngine#detectTensions()}. Fields that do
 * not apply to the finding's kind are empty (lists), {@code null} (endpoints) or 0.
 */
public record TensionFinding(Kind kind,
                             Severity severity,
                             String source,
                             String target,
                             List<String> recordIds,
                             List<String> cycle,
                             double averageTension,
                             int count) {

    public enum Kind { MEANING_CONFLICT, TENSE_CYCLE, ISOLATION }

    public enum Severity { HIGH, MEDIUM, LOW }

    public TensionFinding {
        recordIds = recordIds != null ? List.copyOf(recordIds) : List.of();
        cycle = cycle != null ? List.copyOf(cycle) : List.of();
    }

    public static TensionFinding meaningConflict(String source, String target, String firstId, String secondId) {
        return new TensionFinding(Kind.MEANING_CONFLICT, Severity.HIGH, source, target,
                List.of(firstId, secondId), null, 0.0, 0);
    }

    public static TensionFinding tenseCycle(List<String> cycle, double averageTension) {
        return new TensionFinding(Kind.TENSE_CYCLE, Severity.MEDIUM, null, null, null, cycle, averageTension, 0);
    }

    public static TensionFinding isolation(int count) {
        return new TensionFinding(Kind.ISOLATION, Severity.LOW, null, null, null, null, 0.0, count);
    }
}
