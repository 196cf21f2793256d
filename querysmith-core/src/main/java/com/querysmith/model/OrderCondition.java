package com.querysmith.model;

/**
 * One sort key of an ORDER BY clause.
 *
 * @param variable the sort variable
 * @param ascending true for ASC, false for DESC
 */
public record OrderCondition(Variable variable, boolean ascending) {

    /**
     * Creates a sort key.
     *
     * @param variable the sort variable
     * @param ascending sort direction
     */
    public OrderCondition {
        if (variable == null) {
            throw new QueryValidationException("ORDER BY variable cannot be null");
        }
    }

    /**
     * Render as {@code ASC(?v)} or {@code DESC(?v)}.
     *
     * @return the SPARQL text
     */
    public String toSparql() {
        return (ascending ? "ASC(" : "DESC(") + variable.toSparql() + ")";
    }
}
