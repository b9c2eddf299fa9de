package com.logosk.semanticdb.exceptions;

/**
 * Thrown when a record that was not produced by link prediction is passed to the
 * acceptance workflow.
 */
public class InvalidAcceptanceException extends SemanticDbException {
    private static final long serialVersionUID = 1L;

    private final String edgeId;

    public InvalidAcceptanceException(String edgeId) {
        super("Only suggested edges can be accepted; edge " + edgeId + " is not a suggestion");
        this.edgeId = edgeId;
    }

    public String getEdgeId() {
        return edgeId;
    }
}
