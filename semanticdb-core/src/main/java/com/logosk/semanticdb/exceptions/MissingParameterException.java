package com.logosk.semanticdb.exceptions;

/**
 * Thrown when a query keyword is used without one of its required fields.
 */
public class MissingParameterException extends ValidationException {
    private static final long serialVersionUID = 1L;

    private final String queryType;
    private final String parameter;

    public MissingParameterException(String queryType, String parameter) {
        super(String.format("%s requires :%s", queryType, parameter));
        this.queryType = queryType;
        this.parameter = parameter;
    }

    public String getQueryType() {
        return queryType;
    }

    /**
     * Name of the absent field, without the leading colon.
     */
    public String getParameter() {
        return parameter;
    }
}
