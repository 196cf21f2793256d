package com.querysmith.model;

/**
 * Thrown when a query violates a SPARQL validity rule, for example an
 * aggregation with an unknown function.
 */
public class QueryValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Constructs a new QueryValidationException.
     *
     * @param message the detail message
     */
    public QueryValidationException(final String message) {
        super(message);
    }
}
