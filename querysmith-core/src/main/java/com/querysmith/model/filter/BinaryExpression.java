package com.querysmith.model.filter;

import com.querysmith.model.InvalidPatternException;

/**
 * An infix expression, always rendered in parentheses.
 *
 * @param left the left operand
 * @param operator the operator
 * @param right the right operand
 */
public record BinaryExpression(FilterExpression left, BinaryOperator operator, FilterExpression right)
    implements FilterExpression {

    /**
     * Creates an infix expression.
     *
     * @param left the left operand
     * @param operator the operator
     * @param right the right operand
     */
    public BinaryExpression {
        if (left == null || operator == null || right == null) {
            throw new InvalidPatternException("Binary expression is incomplete");
        }
    }

    @Override
    public String toSparql() {
        return "(" + left.toSparql() + " " + operator.symbol() + " " + right.toSparql() + ")";
    }
}
