package com.querysmith.model.filter;

/**
 * Prefix operators.
 */
public enum UnaryOperator {
    NOT("!"),
    NEGATIVE("-"),
    POSITIVE("+");

    /** SPARQL symbol. */
    private final String symbol;

    UnaryOperator(final String symbol) {
        this.symbol = symbol;
    }

    /**
     * Get the SPARQL symbol.
     *
     * @return e.g. {@code !}
     */
    public String symbol() {
        return symbol;
    }
}
