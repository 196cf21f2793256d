package com.querysmith.model;

import com.querysmith.model.filter.FilterExpression;

/**
 * A FILTER constraint. The expression is kept as SPARQL text and is never
 * interpreted; typed expressions are rendered to text by {@link #of}.
 *
 * @param expression the filter expression, without the surrounding
 *                   {@code FILTER( )}
 */
public record Filter(String expression) {

    /**
     * Creates a filter.
     *
     * @param expression the expression text
     */
    public Filter {
        if (expression == null || expression.isBlank()) {
            throw new InvalidPatternException("Filter expression cannot be empty");
        }
        expression = expression.trim();
    }

    /**
     * Create a filter from an expression tree.
     *
     * @param expression the expression
     * @return the filter
     */
    public static Filter of(final FilterExpression expression) {
        if (expression == null) {
            throw new InvalidPatternException("Filter expression cannot be null");
        }
        return new Filter(expression.toSparql());
    }

    /**
     * Render as a SPARQL FILTER clause.
     *
     * @return the SPARQL text
     */
    public String toSparql() {
        return "FILTER(" + expression + ")";
    }
}
