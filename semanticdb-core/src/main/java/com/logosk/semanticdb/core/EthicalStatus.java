package com.logosk.semanticdb.core;

import java.util.Locale;

/**
 * Lifecycle status of nodes and edge records. Serialised in lower case.
 */
public enum EthicalStatus {
    ACTIVE,
    SLEEPING,
    CONFLICTED,
    RESOLVED,
    ARCHIVED,
    DREAMING;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static EthicalStatus fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return ACTIVE;
        }
        return valueOf(label.trim().toUpperCase(Locale.ROOT));
    }
}
