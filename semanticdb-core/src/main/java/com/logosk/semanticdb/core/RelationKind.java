package com.logosk.semanticdb.core;

import com.logosk.semanticdb.exceptions.UnknownGestureException;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * The six operators of the protocol. Each one is both a relation kind carried by an
 * {@link EdgeRecord} and a gesture tag on recorded events.
 */
public enum RelationKind {
    ALPHA("Α"),  // naming, emergence
    LAMBDA("Λ"), // connection
    SIGMA("Σ"),  // synthesis
    OMEGA("Ω"),  // boundary, resolution
    NABLA("∇"),  // enrichment
    PHI("Φ");    // dialogue

    private final String symbol;

    RelationKind(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Resolves either the Greek symbol or the enum name (case-insensitive).
     *
     * @throws UnknownGestureException if the text names none of the six kinds
     */
    public static RelationKind fromSymbol(String text) {
        if (text != null) {
            String trimmed = text.trim();
            for (RelationKind kind : values()) {
                if (kind.symbol.equals(trimmed) || kind.name().equals(trimmed.toUpperCase(Locale.ROOT))) {
                    return kind;
                }
            }
        }
        throw new UnknownGestureException(text, symbols());
    }

    public static List<String> symbols() {
        return Arrays.stream(values()).map(RelationKind::symbol).collect(Collectors.toList());
    }
}
