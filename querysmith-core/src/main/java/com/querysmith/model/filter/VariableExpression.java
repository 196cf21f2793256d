package com.querysmith.model.filter;

import com.querysmith.model.InvalidPatternException;
import com.querysmith.model.Variable;

/**
 * A variable reference inside an expression.
 *
 * @param variable the referenced variable
 */
public record VariableExpression(Variable variable) implements FilterExpression {

    /**
     * Creates a variable reference.
     *
     * @param variable the variable
     */
    public VariableExpression {
        if (variable == null) {
            throw new InvalidPatternException("Variable cannot be null");
        }
    }

    @Override
    public String toSparql() {
        return variable.toSparql();
    }
}
