package com.logosk.semanticdb.coherence;

import java.util.Locale;

public enum CoherenceStatus {
    EMPTY,
    HEALTHY,
    WARNING,
    CRISIS,
    COLLAPSE;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isCritical() {
        return this == CRISIS || this == COLLAPSE;
    }
}
