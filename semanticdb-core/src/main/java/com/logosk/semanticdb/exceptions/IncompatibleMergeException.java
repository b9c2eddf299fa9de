package com.logosk.semanticdb.exceptions;

/**
 * Thrown when two edge records that do not share source, target and relation kind
 * are merged.
 */
public class IncompatibleMergeException extends SemanticDbException {
    private static final long serialVersionUID = 1L;

    private final String leftId;
    private final String rightId;

    public IncompatibleMergeException(String leftId, String leftKey, String rightId, String rightKey) {
        super(String.format("Cannot merge edge %s [%s] with edge %s [%s]: source, target and type must match",
                leftId, leftKey, rightId, rightKey));
        this.leftId = leftId;
        this.rightId = rightId;
    }

    public String getLeftId() {
        return leftId;
    }

    public String getRightId() {
        return rightId;
    }
}
