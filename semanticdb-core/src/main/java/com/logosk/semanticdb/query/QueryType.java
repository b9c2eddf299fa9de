package com.logosk.semanticdb.query;

import com.logosk.semanticdb.exceptions.UnknownQueryTypeException;

/**
 * The four RQL keywords. {@code Φ} is also accepted spelled out as {@code PHI}.
 */
public enum QueryType {
    PHI("Φ"),
    PATH("QUERY"),
    EXPLORE("EXPLORE"),
    CONTEXT("CONTEXT");

    private final String keyword;

    QueryType(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public static QueryType fromKeyword(String keyword) {
        if ("PHI".equals(keyword)) {
            return PHI;
        }
        for (QueryType type : values()) {
            if (type.keyword.equals(keyword)) {
                return type;
            }
        }
        throw new UnknownQueryTypeException(keyword);
    }
}
