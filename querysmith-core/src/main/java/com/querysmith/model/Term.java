package com.querysmith.model;

/**
 * A term of a triple pattern: either a {@link Variable} or a {@link Constant}.
 *
 * <p>The set of term kinds is closed. Code that needs to tell the two apart
 * uses {@code instanceof} on the permitted subtypes.</p>
 */
public sealed interface Term permits Variable, Constant {

    /**
     * Check if this term is a variable.
     *
     * @return true for variables, false for constants
     */
    boolean isVariable();

    /**
     * Render this term as it appears in SPARQL text.
     *
     * @return the SPARQL surface form
     */
    String toSparql();

    /**
     * Parse a term from its SPARQL surface form.
     *
     * <ul>
     *   <li>{@code ?x} or {@code $x} is a variable</li>
     *   <li>{@code <http://...>} is an IRI</li>
     *   <li>{@code ex:p} or {@code :p} is a prefixed name</li>
     *   <li>anything else is a literal ({@code "abc"@en}, {@code 42}, {@code true})</li>
     * </ul>
     *
     * @param text the term text
     * @return the parsed term
     * @throws IllegalArgumentException if text is null or blank
     */
    static Term parse(final String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Term text cannot be null or blank");
        }
        String trimmed = text.trim();
        char first = trimmed.charAt(0);
        if (first == '?' || first == '$') {
            return Variable.of(trimmed);
        }
        if (first == '<' && trimmed.endsWith(">")) {
            return new Constant(Constant.Kind.IRI, trimmed);
        }
        if (isPrefixedName(trimmed)) {
            return new Constant(Constant.Kind.PREFIXED_NAME, trimmed);
        }
        return new Constant(Constant.Kind.LITERAL, trimmed);
    }

    private static boolean isPrefixedName(final String text) {
        if (text.startsWith("\"") || text.startsWith("'")) {
            return false;
        }
        int colon = text.indexOf(':');
        if (colon < 0) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (i == colon) {
                continue;
            }
            if (!(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.')) {
                return false;
            }
        }
        return colon == 0 || Character.isLetter(text.charAt(0));
    }
}
