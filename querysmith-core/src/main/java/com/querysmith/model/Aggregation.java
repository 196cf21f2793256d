package com.querysmith.model;

import java.util.Locale;
import java.util.Set;

/**
 * An aggregate projection such as {@code (COUNT(DISTINCT ?x) AS ?n)}.
 *
 * @param function the aggregate function name, upper case
 * @param argument the aggregated expression, or {@code *} for COUNT(*)
 * @param alias the result variable
 * @param distinct whether DISTINCT applies to the argument
 */
public record Aggregation(String function, String argument, Variable alias, boolean distinct) {

    /** Supported aggregate functions. */
    public static final Set<String> FUNCTIONS =
        Set.of("COUNT", "SUM", "MIN", "MAX", "AVG", "SAMPLE", "GROUP_CONCAT");

    /**
     * Creates an aggregation.
     *
     * @param function the function name
     * @param argument the argument expression
     * @param alias the result variable
     * @param distinct whether DISTINCT applies
     * @throws QueryValidationException if the function is unknown, the alias
     *         is missing, or {@code *} is used with a function other than COUNT
     */
    public Aggregation {
        if (function == null || !FUNCTIONS.contains(function.toUpperCase(Locale.ROOT))) {
            throw new QueryValidationException("Unsupported aggregate function: " + function);
        }
        function = function.toUpperCase(Locale.ROOT);
        if (argument == null || argument.isBlank()) {
            throw new QueryValidationException(function + " needs an argument");
        }
        argument = argument.trim();
        if ("*".equals(argument) && !"COUNT".equals(function)) {
            throw new QueryValidationException("Only COUNT accepts *, not " + function);
        }
        if (alias == null) {
            throw new QueryValidationException(function + " needs an alias variable");
        }
    }

    /**
     * Render as a SPARQL projection expression.
     *
     * @return e.g. {@code (SUM(?price) AS ?total)}
     */
    public String toSparql() {
        return "(" + function + "(" + (distinct ? "DISTINCT " : "") + argument + ") AS "
            + alias.toSparql() + ")";
    }
}
