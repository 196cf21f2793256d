package com.querysmith.model;

/**
 * Thrown when a pattern tree is structurally malformed: a term is missing, or
 * a UNION, OPTIONAL, group or subquery lacks a required child.
 */
public class InvalidPatternException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Constructs a new InvalidPatternException.
     *
     * @param message the detail message
     */
    public InvalidPatternException(final String message) {
        super(message);
    }
}
