package com.querysmith.model.filter;

/**
 * A node of a FILTER expression tree.
 */
public sealed interface FilterExpression
    permits VariableExpression, LiteralExpression, BinaryExpression, UnaryExpression,
        FunctionCall, InExpression, ExistsExpression {

    /**
     * Render the expression as SPARQL.
     *
     * @return the expression text
     */
    String toSparql();
}
