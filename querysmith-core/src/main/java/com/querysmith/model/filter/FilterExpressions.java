package com.querysmith.model.filter;

import com.querysmith.model.InvalidPatternException;
import com.querysmith.model.Variable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Static factory methods for building {@link FilterExpression} trees.
 * Intended for static import.
 */
public final class FilterExpressions {

    /** Private constructor to prevent instantiation. */
    private FilterExpressions() {
        throw new AssertionError("No instances");
    }

    /**
     * Reference a variable.
     *
     * @param name variable name, with or without {@code ?}
     * @return the reference
     */
    public static VariableExpression var(final String name) {
        return new VariableExpression(Variable.of(name));
    }

    /**
     * Plain string literal.
     *
     * @param value the unescaped value
     * @return the literal
     */
    public static LiteralExpression string(final String value) {
        return new LiteralExpression(value, ValueType.STRING, null, null);
    }

    /**
     * Language-tagged string literal.
     *
     * @param value the unescaped value
     * @param language the language tag
     * @return the literal
     */
    public static LiteralExpression langString(final String value, final String language) {
        return new LiteralExpression(value, ValueType.STRING, null, language);
    }

    /**
     * Typed string literal.
     *
     * @param value the lexical form
     * @param datatype the datatype IRI, without brackets
     * @return the literal
     */
    public static LiteralExpression typed(final String value, final String datatype) {
        return new LiteralExpression(value, ValueType.STRING, datatype, null);
    }

    /**
     * Numeric literal.
     *
     * @param value the number
     * @return the literal
     */
    public static LiteralExpression number(final Number value) {
        if (value == null) {
            throw new InvalidPatternException("Number cannot be null");
        }
        return new LiteralExpression(value.toString(), ValueType.NUMBER, null, null);
    }

    /**
     * Boolean literal.
     *
     * @param value the value
     * @return the literal
     */
    public static LiteralExpression bool(final boolean value) {
        return new LiteralExpression(Boolean.toString(value), ValueType.BOOLEAN, null, null);
    }

    /**
     * IRI constant.
     *
     * @param iri the IRI, without brackets
     * @return the literal
     */
    public static LiteralExpression iri(final String iri) {
        return new LiteralExpression(iri, ValueType.IRI, null, null);
    }

    /**
     * {@code xsd:dateTime} literal.
     *
     * @param value the ISO 8601 lexical form
     * @return the literal
     */
    public static LiteralExpression dateTime(final String value) {
        return new LiteralExpression(value, ValueType.DATE_TIME, null, null);
    }

    /**
     * Conjunction, nested to the right: {@code and(a, b, c)} is
     * {@code (a && (b && c))}. A single operand is returned as is.
     *
     * @param operands at least one operand
     * @return the expression
     */
    public static FilterExpression and(final FilterExpression... operands) {
        return chain(BinaryOperator.AND, operands);
    }

    /**
     * Disjunction, nested to the right like {@link #and}.
     *
     * @param operands at least one operand
     * @return the expression
     */
    public static FilterExpression or(final FilterExpression... operands) {
        return chain(BinaryOperator.OR, operands);
    }

    /**
     * Logical negation.
     *
     * @param operand the operand
     * @return {@code !(operand)}
     */
    public static UnaryExpression not(final FilterExpression operand) {
        return new UnaryExpression(UnaryOperator.NOT, operand);
    }

    public static BinaryExpression equalTo(final FilterExpression left, final FilterExpression right) {
        return new BinaryExpression(left, BinaryOperator.EQUALS, right);
    }

    public static BinaryExpression notEqualTo(final FilterExpression left, final FilterExpression right) {
        return new BinaryExpression(left, BinaryOperator.NOT_EQUALS, right);
    }

    public static BinaryExpression lessThan(final FilterExpression left, final FilterExpression right) {
        return new BinaryExpression(left, BinaryOperator.LESS_THAN, right);
    }

    public static BinaryExpression lessThanOrEqual(final FilterExpression left, final FilterExpression right) {
        return new BinaryExpression(left, BinaryOperator.LESS_THAN_OR_EQUAL, right);
    }

    public static BinaryExpression greaterThan(final FilterExpression left, final FilterExpression right) {
        return new BinaryExpression(left, BinaryOperator.GREATER_THAN, right);
    }

    public static BinaryExpression greaterThanOrEqual(final FilterExpression left,
                                                      final FilterExpression right) {
        return new BinaryExpression(left, BinaryOperator.GREATER_THAN_OR_EQUAL, right);
    }

    /**
     * Call a function.
     *
     * @param name the function name
     * @param arguments the arguments
     * @return the call
     */
    public static FunctionCall function(final String name, final FilterExpression... arguments) {
        return new FunctionCall(name, Arrays.asList(arguments));
    }

    /**
     * {@code REGEX(text, pattern)}.
     *
     * @param text the tested expression
     * @param pattern the regular expression
     * @return the call
     */
    public static FunctionCall regex(final FilterExpression text, final FilterExpression pattern) {
        return function("REGEX", text, pattern);
    }

    /**
     * {@code REGEX(text, pattern, flags)}.
     *
     * @param text the tested expression
     * @param pattern the regular expression
     * @param flags the flags, e.g. {@code "i"}
     * @return the call
     */
    public static FunctionCall regex(final FilterExpression text, final FilterExpression pattern,
                                     final FilterExpression flags) {
        return function("REGEX", text, pattern, flags);
    }

    /**
     * {@code STR(operand)}.
     *
     * @param operand the operand
     * @return the call
     */
    public static FunctionCall str(final FilterExpression operand) {
        return function("STR", operand);
    }

    /**
     * {@code BOUND(?v)}.
     *
     * @param variable the variable
     * @return the call
     */
    public static FunctionCall bound(final VariableExpression variable) {
        return function("BOUND", variable);
    }

    /**
     * {@code operand IN (values)}.
     *
     * @param operand the tested expression
     * @param values the candidates
     * @return the test
     */
    public static InExpression in(final FilterExpression operand, final FilterExpression... values) {
        return new InExpression(operand, Arrays.asList(values), false);
    }

    /**
     * {@code operand NOT IN (values)}.
     *
     * @param operand the tested expression
     * @param values the candidates
     * @return the test
     */
    public static InExpression notIn(final FilterExpression operand, final FilterExpression... values) {
        return new InExpression(operand, Arrays.asList(values), true);
    }

    /**
     * {@code EXISTS { pattern }}.
     *
     * @param pattern group content as SPARQL text
     * @return the test
     */
    public static ExistsExpression exists(final String pattern) {
        return new ExistsExpression(pattern, false);
    }

    /**
     * {@code NOT EXISTS { pattern }}.
     *
     * @param pattern group content as SPARQL text
     * @return the test
     */
    public static ExistsExpression notExists(final String pattern) {
        return new ExistsExpression(pattern, true);
    }

    private static FilterExpression chain(final BinaryOperator operator, final FilterExpression... operands) {
        if (operands == null || operands.length == 0) {
            throw new InvalidPatternException(operator + " needs at least one operand");
        }
        List<FilterExpression> list = new ArrayList<>(Arrays.asList(operands));
        FilterExpression result = list.remove(list.size() - 1);
        for (int i = list.size() - 1; i >= 0; i--) {
            result = new BinaryExpression(list.get(i), operator, result);
        }
        return result;
    }
}
