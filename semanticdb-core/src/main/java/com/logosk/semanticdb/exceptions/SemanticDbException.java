package com.logosk.semanticdb.exceptions;

/**
 * Base type for every recoverable error raised by the semantic graph core.
 */
public class SemanticDbException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public SemanticDbException(String message) {
        super(message);
    }

    public SemanticDbException(String message, Throwable cause) {
        super(message, cause);
    }
}
