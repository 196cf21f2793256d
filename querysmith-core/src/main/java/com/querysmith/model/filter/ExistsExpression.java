package com.querysmith.model.filter;

import com.querysmith.model.InvalidPatternException;

/**
 * An {@code EXISTS { ... }} or {@code NOT EXISTS { ... }} test. The graph
 * pattern is kept as SPARQL text.
 *
 * @param pattern the group content, without the braces
 * @param negated true for NOT EXISTS
 */
public record ExistsExpression(String pattern, boolean negated) implements FilterExpression {

    /**
     * Creates an existence test.
     *
     * @param pattern the group content
     * @param negated true for NOT EXISTS
     */
    public ExistsExpression {
        if (pattern == null || pattern.isBlank()) {
            throw new InvalidPatternException("EXISTS needs a graph pattern");
        }
        pattern = pattern.trim();
    }

    @Override
    public String toSparql() {
        return (negated ? "NOT EXISTS { " : "EXISTS { ") + pattern + " }";
    }
}
