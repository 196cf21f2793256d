package com.querysmith.model;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * A subject-predicate-object template whose positions hold variables or
 * constants.
 *
 * @param subject the subject term
 * @param predicate the predicate term
 * @param object the object term
 */
public record TriplePattern(Term subject, Term predicate, Term object) {

    /**
     * Creates a triple pattern.
     *
     * @param subject the subject term
     * @param predicate the predicate term
     * @param object the object term
     * @throws InvalidPatternException if any term is null
     */
    public TriplePattern {
        if (subject == null || predicate == null || object == null) {
            throw new InvalidPatternException(
                "Triple pattern terms cannot be null: ("
                    + subject + ", " + predicate + ", " + object + ")");
        }
    }

    /**
     * Create a triple pattern from the surface form of its terms.
     *
     * @param subject the subject text, e.g. {@code ?s}
     * @param predicate the predicate text, e.g. {@code ex:p}
     * @param object the object text, e.g. {@code "Alice"}
     * @return the triple pattern
     * @see Term#parse(String)
     */
    public static TriplePattern of(final String subject,
                                   final String predicate,
                                   final String object) {
        return new TriplePattern(
            Term.parse(subject), Term.parse(predicate), Term.parse(object));
    }

    /**
     * Get the three terms in subject, predicate, object order.
     *
     * @return the terms
     */
    public List<Term> terms() {
        return List.of(subject, predicate, object);
    }

    /**
     * Get the variables of this triple, in position order, duplicates kept.
     *
     * @return the variables
     */
    public List<Variable> variables() {
        List<Variable> variables = new ArrayList<>(3);
        for (Term term : terms()) {
            if (term instanceof Variable variable) {
                variables.add(variable);
            }
        }
        return variables;
    }

    /**
     * Check if all three positions hold variables.
     *
     * @return true if the triple contains no constant
     */
    public boolean isAllVariables() {
        return subject.isVariable() && predicate.isVariable() && object.isVariable();
    }

    /**
     * Count the constant positions of this triple.
     *
     * @return number of constants, 0 to 3
     */
    public int constantCount() {
        int count = 0;
        for (Term term : terms()) {
            if (!term.isVariable()) {
                count++;
            }
        }
        return count;
    }

    /**
     * Return a copy with every term passed through the given function.
     *
     * @param replacement term replacement function
     * @return the rewritten triple
     */
    public TriplePattern map(final UnaryOperator<Term> replacement) {
        return new TriplePattern(
            replacement.apply(subject),
            replacement.apply(predicate),
            replacement.apply(object));
    }

    /**
     * Render as a SPARQL triple, without the trailing dot.
     *
     * @return the SPARQL text
     */
    public String toSparql() {
        return subject.toSparql() + " " + predicate.toSparql() + " " + object.toSparql();
    }

    @Override
    public String toString() {
        return toSparql();
    }
}
