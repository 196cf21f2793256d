package com.querysmith.model;

/**
 * Thrown when an ORDER BY clause references a variable that is not available
 * after grouping.
 */
public class OrderByValidationException extends QueryValidationException {

    private static final long serialVersionUID = 1L;

    /**
     * Constructs a new OrderByValidationException.
     *
     * @param message the detail message
     */
    public OrderByValidationException(final String message) {
        super(message);
    }
}
