package com.querysmith.model;

/**
 * A query variable such as {@code ?person}.
 *
 * <p>The name is stored without the leading {@code ?} or {@code $}. It is an
 * identity key only: the isomorphism engine never compares variable names
 * across the two patterns it is given.</p>
 *
 * @param name the variable name, without the sigil
 */
public record Variable(String name) implements Term {

    /**
     * Creates a variable.
     *
     * @param name the variable name, with or without a leading sigil
     */
    public Variable {
        if (name == null) {
            throw new InvalidPatternException("Variable name cannot be null");
        }
        if (name.startsWith("?") || name.startsWith("$")) {
            name = name.substring(1);
        }
        if (name.isEmpty()) {
            throw new InvalidPatternException("Variable name cannot be empty");
        }
    }

    /**
     * Create a variable from text such as {@code ?x}, {@code $x} or {@code x}.
     *
     * @param text the variable text
     * @return the variable
     */
    public static Variable of(final String text) {
        return new Variable(text);
    }

    @Override
    public boolean isVariable() {
        return true;
    }

    @Override
    public String toSparql() {
        return "?" + name;
    }

    @Override
    public String toString() {
        return toSparql();
    }
}
