package com.logosk.semanticdb.exceptions;

/**
 * Thrown when node, edge or query input is malformed: blank identifiers,
 * confidence or tension outside [0,1], unparseable query text.
 */
public class ValidationException extends SemanticDbException {
    private static final long serialVersionUID = 1L;

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
