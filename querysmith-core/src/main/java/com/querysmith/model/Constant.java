package com.querysmith.model;

/**
 * A constant term: an IRI, a prefixed name or a literal.
 *
 * <p>Constants are compared by kind and surface text. Two constants that
 * denote the same RDF term but are written differently (for example a prefixed
 * name and its expanded IRI) are not equal.</p>
 *
 * @param kind the constant kind
 * @param text the SPARQL surface form
 */
public record Constant(Kind kind, String text) implements Term {

    /**
     * The kinds of constant.
     */
    public enum Kind {
        /** Full IRI in angle brackets. */
        IRI,
        /** Prefixed name such as {@code foaf:name}. */
        PREFIXED_NAME,
        /** Literal value: string, number or boolean. */
        LITERAL
    }

    /**
     * Creates a constant.
     *
     * @param kind the constant kind
     * @param text the surface form
     */
    public Constant {
        if (kind == null) {
            throw new InvalidPatternException("Constant kind cannot be null");
        }
        if (text == null || text.isEmpty()) {
            throw new InvalidPatternException("Constant text cannot be empty");
        }
    }

    /**
     * Create an IRI constant. Angle brackets are added if missing.
     *
     * @param iri the IRI, bracketed or not
     * @return the constant
     */
    public static Constant iri(final String iri) {
        if (iri != null && iri.startsWith("<") && iri.endsWith(">")) {
            return new Constant(Kind.IRI, iri);
        }
        return new Constant(Kind.IRI, "<" + iri + ">");
    }

    /**
     * Create a prefixed-name constant such as {@code ex:p}.
     *
     * @param name the prefixed name
     * @return the constant
     */
    public static Constant prefixedName(final String name) {
        return new Constant(Kind.PREFIXED_NAME, name);
    }

    /**
     * Create a literal constant from its SPARQL surface form.
     *
     * @param lexical the literal as written, quotes included for strings
     * @return the constant
     */
    public static Constant literal(final String lexical) {
        return new Constant(Kind.LITERAL, lexical);
    }

    @Override
    public boolean isVariable() {
        return false;
    }

    @Override
    public String toSparql() {
        return text;
    }

    @Override
    public String toString() {
        return text;
    }
}
