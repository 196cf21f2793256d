package com.querysmith.analysis;

import com.querysmith.model.Patterns;
import com.querysmith.model.SelectQuery;
import com.querysmith.model.Term;
import com.querysmith.model.TriplePattern;
import com.querysmith.model.Variable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Counts and collections over the where-clause of a query.
 *
 * <p>All methods descend into unions, optionals, groups and subqueries.
 * Variables mentioned only in filter expressions or the projection are not
 * collected.</p>
 */
public final class QueryStatistics {

    private QueryStatistics() {
        throw new AssertionError("No instances");
    }

    /**
     * Collect the variables of all triple patterns.
     *
     * @param query the query
     * @return variables in order of first appearance
     */
    public static Set<Variable> variables(final SelectQuery query) {
        Set<Variable> variables = new LinkedHashSet<>();
        for (TriplePattern triple : triplePatterns(query)) {
            variables.addAll(triple.variables());
        }
        return Collections.unmodifiableSet(variables);
    }

    /**
     * Count the triple patterns.
     *
     * @param query the query
     * @return the number of triple patterns
     */
    public static int triplePatternCount(final SelectQuery query) {
        int[] count = {0};
        Patterns.forEachBgp(query.where(), true, bgp -> count[0] += bgp.size());
        return count[0];
    }

    /**
     * Count the basic graph patterns.
     *
     * @param query the query
     * @return the number of BGPs, including empty and filter-only ones
     */
    public static int bgpCount(final SelectQuery query) {
        int[] count = {0};
        Patterns.forEachBgp(query.where(), true, bgp -> count[0]++);
        return count[0];
    }

    /**
     * List the triple patterns in document order.
     *
     * @param query the query
     * @return all triple patterns
     */
    public static List<TriplePattern> triplePatterns(final SelectQuery query) {
        List<TriplePattern> triples = new ArrayList<>();
        Patterns.forEachBgp(query.where(), true, bgp -> triples.addAll(bgp.triples()));
        return Collections.unmodifiableList(triples);
    }

    /**
     * Check whether subject, predicate and object are all variables.
     *
     * @param triple the triple pattern
     * @return true if no term is a constant
     */
    public static boolean allVariables(final TriplePattern triple) {
        return triple.terms().stream().allMatch(Term::isVariable);
    }
}
