package com.querysmith.model.filter;

import com.querysmith.model.InvalidPatternException;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A membership test, {@code ?x IN (a, b)} or {@code ?x NOT IN (a, b)}.
 *
 * @param operand the tested expression
 * @param values the candidate values
 * @param negated true for NOT IN
 */
public record InExpression(FilterExpression operand, List<FilterExpression> values, boolean negated)
    implements FilterExpression {

    /**
     * Creates a membership test.
     *
     * @param operand the tested expression
     * @param values the candidate values
     * @param negated true for NOT IN
     */
    public InExpression {
        if (operand == null) {
            throw new InvalidPatternException("IN needs an operand");
        }
        if (values == null || values.stream().anyMatch(Objects::isNull)) {
            throw new InvalidPatternException("IN has a missing value");
        }
        values = List.copyOf(values);
    }

    @Override
    public String toSparql() {
        return operand.toSparql() + (negated ? " NOT IN (" : " IN (")
            + values.stream().map(FilterExpression::toSparql).collect(Collectors.joining(", ")) + ")";
    }
}
