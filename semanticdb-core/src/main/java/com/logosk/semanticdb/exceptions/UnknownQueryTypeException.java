package com.logosk.semanticdb.exceptions;

public class UnknownQueryTypeException extends SemanticDbException {
    private static final long serialVersionUID = 1L;

    private final String keyword;

    public UnknownQueryTypeException(String keyword) {
        super("Unknown RQL query type: " + keyword);
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }
}
