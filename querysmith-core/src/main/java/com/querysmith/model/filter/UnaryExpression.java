package com.querysmith.model.filter;

import com.querysmith.model.InvalidPatternException;

/**
 * A prefix expression such as {@code !(bound(?x))}.
 *
 * @param operator the operator
 * @param operand the operand
 */
public record UnaryExpression(UnaryOperator operator, FilterExpression operand) implements FilterExpression {

    /**
     * Creates a prefix expression.
     *
     * @param operator the operator
     * @param operand the operand
     */
    public UnaryExpression {
        if (operator == null || operand == null) {
            throw new InvalidPatternException("Unary expression is incomplete");
        }
    }

    @Override
    public String toSparql() {
        return operator.symbol() + "(" + operand.toSparql() + ")";
    }
}
