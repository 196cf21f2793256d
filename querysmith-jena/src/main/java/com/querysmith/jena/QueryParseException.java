package com.querysmith.jena;

/**
 * Thrown when SPARQL text cannot be turned into a
 * {@link com.querysmith.model.SelectQuery}: a syntax error reported by Jena,
 * a query form other than SELECT, or a construct the model cannot express.
 */
public class QueryParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Constructs a new QueryParseException.
     *
     * @param message the error message
     */
    public QueryParseException(final String message) {
        super(message);
    }

    /**
     * Constructs a new QueryParseException with a cause.
     *
     * @param message the error message
     * @param cause the underlying exception
     */
    public QueryParseException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
