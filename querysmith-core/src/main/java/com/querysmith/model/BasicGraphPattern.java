package com.querysmith.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * A basic graph pattern: triple patterns that must all match, plus the
 * filters attached to them. The order of triples and filters carries no
 * meaning.
 */
public final class BasicGraphPattern implements Pattern {

    /** Triple patterns, in insertion order. */
    private final List<TriplePattern> triples = new ArrayList<>();

    /** Filters, in insertion order. */
    private final List<Filter> filters = new ArrayList<>();

    /**
     * Creates an empty BGP.
     */
    public BasicGraphPattern() {
        // Empty pattern
    }

    /**
     * Creates a BGP with the given triples and filters.
     *
     * @param triples the triple patterns
     * @param filters the filters
     */
    public BasicGraphPattern(final List<TriplePattern> triples, final List<Filter> filters) {
        triples.forEach(this::add);
        filters.forEach(this::add);
    }

    /**
     * Creates a BGP with the given triples and no filter.
     *
     * @param triples the triple patterns
     * @return the BGP
     */
    public static BasicGraphPattern of(final TriplePattern... triples) {
        return new BasicGraphPattern(List.of(triples), List.of());
    }

    @Override
    public PatternKind kind() {
        return PatternKind.BGP;
    }

    /**
     * Add a triple pattern.
     *
     * @param triple the triple
     * @return this BGP
     */
    public BasicGraphPattern add(final TriplePattern triple) {
        if (triple == null) {
            throw new InvalidPatternException("Cannot add a null triple pattern");
        }
        triples.add(triple);
        return this;
    }

    /**
     * Add a triple pattern built from three terms.
     *
     * @param subject the subject
     * @param predicate the predicate
     * @param object the object
     * @return this BGP
     */
    public BasicGraphPattern add(final Term subject, final Term predicate, final Term object) {
        return add(new TriplePattern(subject, predicate, object));
    }

    /**
     * Add a triple pattern from the surface form of its terms.
     *
     * @param subject the subject text
     * @param predicate the predicate text
     * @param object the object text
     * @return this BGP
     */
    public BasicGraphPattern add(final String subject, final String predicate, final String object) {
        return add(TriplePattern.of(subject, predicate, object));
    }

    /**
     * Attach a filter.
     *
     * @param filter the filter
     * @return this BGP
     */
    public BasicGraphPattern add(final Filter filter) {
        if (filter == null) {
            throw new InvalidPatternException("Cannot add a null filter");
        }
        filters.add(filter);
        return this;
    }

    /**
     * Attach a filter given as expression text.
     *
     * @param expression the filter expression
     * @return this BGP
     */
    public BasicGraphPattern addFilter(final String expression) {
        return add(new Filter(expression));
    }

    /**
     * Remove the first occurrence of a triple pattern.
     *
     * @param triple the triple to remove
     * @return true if the triple was present
     */
    public boolean remove(final TriplePattern triple) {
        return triples.remove(triple);
    }

    /**
     * Remove the first occurrence of a filter.
     *
     * @param filter the filter to remove
     * @return true if the filter was present
     */
    public boolean remove(final Filter filter) {
        return filters.remove(filter);
    }

    /**
     * Get the triple patterns.
     *
     * @return unmodifiable view of the triples
     */
    public List<TriplePattern> triples() {
        return Collections.unmodifiableList(triples);
    }

    /**
     * Get the filters.
     *
     * @return unmodifiable view of the filters
     */
    public List<Filter> filters() {
        return Collections.unmodifiableList(filters);
    }

    /**
     * Get the number of triple patterns.
     *
     * @return the triple count
     */
    public int size() {
        return triples.size();
    }

    /**
     * Check if the BGP holds neither triples nor filters.
     *
     * @return true if empty
     */
    public boolean isEmpty() {
        return triples.isEmpty() && filters.isEmpty();
    }

    /**
     * Rewrite every term of every triple in place.
     *
     * @param replacement term replacement function
     */
    void rewriteTerms(final UnaryOperator<Term> replacement) {
        triples.replaceAll(triple -> triple.map(replacement));
    }

    @Override
    public BasicGraphPattern copy() {
        return new BasicGraphPattern(triples, filters);
    }

    @Override
    public String toString() {
        return "BGP" + triples + (filters.isEmpty() ? "" : " " + filters);
    }
}
