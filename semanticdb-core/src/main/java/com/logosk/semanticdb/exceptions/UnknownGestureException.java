package com.logosk.semanticdb.exceptions;

import java.util.List;

/**
 * Thrown when a relation kind or gesture symbol is not one of the six known operators.
 */
public class UnknownGestureException extends SemanticDbException {
    private static final long serialVersionUID = 1L;

    private final String symbol;

    public UnknownGestureException(String symbol, List<String> allowed) {
        super(String.format("Unknown gesture '%s'. Allowed: %s", symbol, allowed));
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
