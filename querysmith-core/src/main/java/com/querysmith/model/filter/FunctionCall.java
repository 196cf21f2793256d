package com.querysmith.model.filter;

import com.querysmith.model.InvalidPatternException;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A built-in or extension function call such as {@code REGEX(?x, "a")}.
 *
 * @param name the function name, or an IRI in angle brackets
 * @param arguments the arguments, possibly empty
 */
public record FunctionCall(String name, List<FilterExpression> arguments) implements FilterExpression {

    /**
     * Creates a function call.
     *
     * @param name the function name
     * @param arguments the arguments
     */
    public FunctionCall {
        if (name == null || name.isBlank()) {
            throw new InvalidPatternException("Function name cannot be empty");
        }
        if (arguments == null || arguments.stream().anyMatch(Objects::isNull)) {
            throw new InvalidPatternException("Function " + name + " has a missing argument");
        }
        arguments = List.copyOf(arguments);
    }

    @Override
    public String toSparql() {
        return name + "(" + arguments.stream()
            .map(FilterExpression::toSparql)
            .collect(Collectors.joining(", ")) + ")";
    }
}
