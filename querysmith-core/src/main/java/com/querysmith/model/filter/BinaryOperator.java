package com.querysmith.model.filter;

/**
 * Infix operators.
 */
public enum BinaryOperator {
    AND("&&"),
    OR("||"),
    EQUALS("="),
    NOT_EQUALS("!="),
    LESS_THAN("<"),
    LESS_THAN_OR_EQUAL("<="),
    GREATER_THAN(">"),
    GREATER_THAN_OR_EQUAL(">="),
    PLUS("+"),
    MINUS("-"),
    MULTIPLY("*"),
    DIVIDE("/");

    /** SPARQL symbol. */
    private final String symbol;

    BinaryOperator(final String symbol) {
        this.symbol = symbol;
    }

    /**
     * Get the SPARQL symbol.
     *
     * @return e.g. {@code &&}
     */
    public String symbol() {
        return symbol;
    }
}
