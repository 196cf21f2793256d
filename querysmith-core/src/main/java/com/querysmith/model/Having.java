package com.querysmith.model;

/**
 * A HAVING condition evaluated over groups after aggregation.
 *
 * @param expression the condition text, without the surrounding
 *                   {@code HAVING( )}
 */
public record Having(String expression) {

    /**
     * Creates a HAVING condition.
     *
     * @param expression the condition text
     */
    public Having {
        if (expression == null || expression.isBlank()) {
            throw new QueryValidationException("HAVING expression cannot be empty");
        }
        expression = expression.trim();
    }
}
