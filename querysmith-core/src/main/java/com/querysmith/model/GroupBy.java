package com.querysmith.model;

import java.util.Arrays;
import java.util.List;

/**
 * A GROUP BY clause over plain variables.
 *
 * @param variables the grouping variables
 */
public record GroupBy(List<Variable> variables) {

    /**
     * Creates a GROUP BY clause.
     *
     * @param variables the grouping variables
     */
    public GroupBy {
        if (variables == null || variables.isEmpty()) {
            throw new QueryValidationException("GROUP BY needs at least one variable");
        }
        variables = List.copyOf(variables);
    }

    /**
     * Create a GROUP BY clause from variable text.
     *
     * @param variables variable names such as {@code ?x}
     * @return the clause
     */
    public static GroupBy of(final String... variables) {
        return new GroupBy(Arrays.stream(variables).map(Variable::of).toList());
    }
}
