package com.querysmith.model;

import java.util.ArrayList;
import java.util.List;

/**
 * An ORDER BY clause.
 *
 * @param conditions the sort keys, most significant first
 */
public record OrderBy(List<OrderCondition> conditions) {

    /**
     * Creates an ORDER BY clause.
     *
     * @param conditions the sort keys
     */
    public OrderBy {
        if (conditions == null || conditions.isEmpty()) {
            throw new OrderByValidationException("ORDER BY needs at least one condition");
        }
        conditions = List.copyOf(conditions);
    }

    /**
     * Order by the given variables, all in the same direction.
     *
     * @param ascending sort direction for every variable
     * @param variables variable text such as {@code ?x}
     * @return the clause
     */
    public static OrderBy of(final boolean ascending, final String... variables) {
        List<OrderCondition> conditions = new ArrayList<>();
        for (String variable : variables) {
            conditions.add(new OrderCondition(Variable.of(variable), ascending));
        }
        return new OrderBy(conditions);
    }

    /**
     * Order by the given variables with one direction flag per variable.
     * Variables without a flag sort ascending.
     *
     * @param variables the variables
     * @param ascending direction flags, may be shorter than variables
     * @return the clause
     */
    public static OrderBy of(final List<Variable> variables, final List<Boolean> ascending) {
        List<OrderCondition> conditions = new ArrayList<>();
        for (int i = 0; i < variables.size(); i++) {
            boolean asc = i >= ascending.size() || ascending.get(i);
            conditions.add(new OrderCondition(variables.get(i), asc));
        }
        return new OrderBy(conditions);
    }

    /**
     * Get the sort variables in order.
     *
     * @return the variables
     */
    public List<Variable> variables() {
        return conditions.stream().map(OrderCondition::variable).toList();
    }
}
