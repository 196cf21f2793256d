package com.querysmith.model;

import com.querysmith.analysis.QueryStatistics;
import com.querysmith.iso.IsomorphismChecker;
import com.querysmith.render.QueryRenderer;
import com.querysmith.render.StructurePrinter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A SPARQL SELECT query: projection, where-clause and solution modifiers.
 *
 * <p>The where-clause is an ordered list of sibling patterns. Mutation goes
 * through {@link #add(Pattern)}, {@link #add(Filter)} and the matching
 * {@code remove} methods; {@link #instantiate(Map)} and
 * {@link #replaceTriplePatternsWithSubqueries(long)} return new queries.</p>
 *
 * <pre>{@code
 * SelectQuery query = SelectQuery.builder()
 *     .select("?person", "?name")
 *     .where(BasicGraphPattern.of(
 *         TriplePattern.of("?person", "foaf:name", "?name")))
 *     .limit(10)
 *     .build();
 * }</pre>
 */
public final class SelectQuery {

    /** Projected variables; empty means {@code SELECT *}. */
    private final List<Variable> projection;

    /** Aggregate projections. */
    private final List<Aggregation> aggregations;

    /** Whether DISTINCT applies to the projection. */
    private boolean distinct;

    /** FROM graph IRI, or null. */
    private String from;

    /** Where-clause siblings. */
    private final List<Pattern> where;

    /** Filters at the top level of the where-clause. */
    private final List<Filter> filters;

    /** GROUP BY clause, or null. */
    private GroupBy groupBy;

    /** HAVING conditions. */
    private final List<Having> having;

    /** ORDER BY clause, or null. */
    private OrderBy orderBy;

    /** LIMIT, or null. */
    private Long limit;

    /** OFFSET, or null. */
    private Long offset;

    private SelectQuery(final Builder builder) {
        this.projection = new ArrayList<>(builder.projection);
        this.aggregations = new ArrayList<>(builder.aggregations);
        this.distinct = builder.distinct;
        this.from = builder.from;
        this.where = new ArrayList<>(builder.where);
        this.filters = new ArrayList<>(builder.filters);
        this.groupBy = builder.groupBy;
        this.having = new ArrayList<>(builder.having);
        this.orderBy = builder.orderBy;
        this.limit = builder.limit;
        this.offset = builder.offset;
        validateModifiers();
    }

    /**
     * Obtain a {@link Builder} for a new query.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Append a pattern to the where-clause.
     *
     * @param pattern the pattern
     * @return this query
     */
    public SelectQuery add(final Pattern pattern) {
        if (pattern == null) {
            throw new InvalidPatternException("Cannot add a null pattern to a query");
        }
        where.add(pattern);
        return this;
    }

    /**
     * Add a filter at the top level of the where-clause.
     *
     * @param filter the filter
     * @return this query
     */
    public SelectQuery add(final Filter filter) {
        if (filter == null) {
            throw new InvalidPatternException("Cannot add a null filter to a query");
        }
        filters.add(filter);
        return this;
    }

    /**
     * Add a HAVING condition.
     *
     * @param condition the condition
     * @return this query
     */
    public SelectQuery add(final Having condition) {
        having.add(condition);
        return this;
    }

    /**
     * Add an aggregate projection.
     *
     * @param aggregation the aggregation
     * @return this query
     */
    public SelectQuery add(final Aggregation aggregation) {
        aggregations.add(aggregation);
        return this;
    }

    /**
     * Remove a top-level pattern, compared by identity.
     *
     * @param pattern the pattern
     * @return true if it was a top-level pattern of this query
     */
    public boolean remove(final Pattern pattern) {
        return Patterns.removeByIdentity(where, pattern);
    }

    /**
     * Remove a top-level filter.
     *
     * @param filter the filter
     * @return true if it was present
     */
    public boolean remove(final Filter filter) {
        return filters.remove(filter);
    }

    /**
     * Remove a HAVING condition.
     *
     * @param condition the condition
     * @return true if it was present
     */
    public boolean remove(final Having condition) {
        return having.remove(condition);
    }

    /**
     * Replace the GROUP BY clause.
     *
     * @param value the clause, or null to drop it
     */
    public void setGroupBy(final GroupBy value) {
        this.groupBy = value;
        validateModifiers();
    }

    /**
     * Replace the ORDER BY clause.
     *
     * @param value the clause, or null to drop it
     */
    public void setOrderBy(final OrderBy value) {
        this.orderBy = value;
        validateModifiers();
    }

    /**
     * Set the LIMIT.
     *
     * @param value the limit, or null to drop it
     */
    public void setLimit(final Long value) {
        this.limit = requireNonNegative("LIMIT", value);
    }

    /**
     * Set the OFFSET.
     *
     * @param value the offset, or null to drop it
     */
    public void setOffset(final Long value) {
        this.offset = requireNonNegative("OFFSET", value);
    }

    /**
     * Toggle DISTINCT.
     *
     * @param value whether DISTINCT applies
     */
    public void setDistinct(final boolean value) {
        this.distinct = value;
    }

    /**
     * Set the FROM graph.
     *
     * @param value graph IRI without brackets, or null
     */
    public void setFrom(final String value) {
        this.from = value;
    }

    /**
     * Replace the projection.
     *
     * @param variables the projected variables; empty for {@code *}
     */
    public void setProjection(final List<Variable> variables) {
        projection.clear();
        projection.addAll(variables);
    }

    /**
     * Create a deep copy of this query.
     *
     * @return the copy
     */
    public SelectQuery copy() {
        return toBuilder().build();
    }

    /**
     * Create a builder pre-populated with a deep copy of this query.
     *
     * @return the builder
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.projection.addAll(projection);
        builder.aggregations.addAll(aggregations);
        builder.distinct = distinct;
        builder.from = from;
        builder.where.addAll(Patterns.copyAll(where));
        builder.filters.addAll(filters);
        builder.groupBy = groupBy;
        builder.having.addAll(having);
        builder.orderBy = orderBy;
        builder.limit = limit;
        builder.offset = offset;
        return builder;
    }

    /**
     * Replace variables by IRIs.
     *
     * <p>Every variable whose name is a key of the mapping becomes the IRI
     * constant {@code <value>} throughout the where-clause. Nested subqueries
     * are instantiated the same way, projection included. Instantiated
     * variables leave an explicit projection; if none remain, the projection
     * lists every variable still in the where-clause.
     * This query is not modified.</p>
     *
     * @param mapping variable name, with or without {@code ?}, to IRI
     * @return the instantiated query
     */
    public SelectQuery instantiate(final Map<String, String> mapping) {
        Map<String, String> byName = new HashMap<>();
        mapping.forEach((key, value) -> byName.put(Variable.of(key).name(), value));

        SelectQuery result = copy();
        Patterns.rewriteTerms(result.where, term -> {
            if (term instanceof Variable variable && byName.containsKey(variable.name())) {
                return Constant.iri(byName.get(variable.name()));
            }
            return term;
        });
        Patterns.forEachSubQuery(result.where, subQuery -> {
            if (subQuery.query() != null) {
                subQuery.query(subQuery.query().instantiate(mapping));
            }
        });
        if (!result.projection.isEmpty()) {
            result.projection.removeIf(variable -> byName.containsKey(variable.name()));
            if (result.projection.isEmpty()) {
                result.projection.addAll(result.allVariables());
            }
        }
        return result;
    }

    /**
     * Rewrite every BGP as a sequence of single-triple subqueries, each
     * {@code SELECT * ... LIMIT limit}. Filters of a split BGP are kept in a
     * filter-only BGP next to the subqueries. This query is not modified.
     *
     * @param limit the LIMIT of the generated subqueries
     * @return the rewritten query
     */
    public SelectQuery replaceTriplePatternsWithSubqueries(final long limit) {
        Patterns.validate(where);
        Builder builder = toBuilder();
        builder.where.clear();
        for (Pattern pattern : where) {
            builder.where.addAll(Patterns.splitIntoSubqueries(pattern, limit));
        }
        return builder.build();
    }

    /**
     * Collect the variables of the where-clause, in order of appearance.
     *
     * @return the variables
     */
    public Set<Variable> allVariables() {
        return QueryStatistics.variables(this);
    }

    /**
     * Count triple patterns in the where-clause, subqueries included.
     *
     * @return the count
     */
    public int triplePatternCount() {
        return QueryStatistics.triplePatternCount(this);
    }

    /**
     * Count BGPs in the where-clause, subqueries included.
     *
     * @return the count
     */
    public int bgpCount() {
        return QueryStatistics.bgpCount(this);
    }

    /**
     * Extract every triple pattern of the where-clause.
     *
     * @return the triples, in tree order
     */
    public List<TriplePattern> triplePatterns() {
        return QueryStatistics.triplePatterns(this);
    }

    /**
     * Check if this query's where-clause is structurally equivalent to
     * another's under a renaming of variables. Projection and solution
     * modifiers are ignored; the number of top-level filters must match.
     *
     * @param other the other query
     * @return true if isomorphic
     */
    public boolean isIsomorphic(final SelectQuery other) {
        return IsomorphismChecker.defaultChecker().isomorphic(this, other);
    }

    /**
     * Render as SPARQL text.
     *
     * @return the query string
     */
    public String toQueryString() {
        return QueryRenderer.render(this);
    }

    @Override
    public String toString() {
        return StructurePrinter.print(this);
    }

    /**
     * Get the projected variables.
     *
     * @return the variables; empty for {@code SELECT *}
     */
    public List<Variable> projection() {
        return Collections.unmodifiableList(projection);
    }

    /**
     * Check if the projection is {@code *}.
     *
     * @return true for {@code SELECT *}
     */
    public boolean isSelectAll() {
        return projection.isEmpty() && aggregations.isEmpty();
    }

    /**
     * Get the aggregate projections.
     *
     * @return the aggregations
     */
    public List<Aggregation> aggregations() {
        return Collections.unmodifiableList(aggregations);
    }

    /**
     * Check if DISTINCT applies.
     *
     * @return true for SELECT DISTINCT
     */
    public boolean isDistinct() {
        return distinct;
    }

    /**
     * Get the FROM graph.
     *
     * @return the graph IRI, or null
     */
    public String from() {
        return from;
    }

    /**
     * Get the where-clause siblings.
     *
     * @return unmodifiable view of the where-clause
     */
    public List<Pattern> where() {
        return Collections.unmodifiableList(where);
    }

    /**
     * Get the top-level filters.
     *
     * @return the filters
     */
    public List<Filter> filters() {
        return Collections.unmodifiableList(filters);
    }

    /**
     * Get the GROUP BY clause.
     *
     * @return the clause, or null
     */
    public GroupBy groupBy() {
        return groupBy;
    }

    /**
     * Get the HAVING conditions.
     *
     * @return the conditions
     */
    public List<Having> having() {
        return Collections.unmodifiableList(having);
    }

    /**
     * Get the ORDER BY clause.
     *
     * @return the clause, or null
     */
    public OrderBy orderBy() {
        return orderBy;
    }

    /**
     * Get the LIMIT.
     *
     * @return the limit, or null
     */
    public Long limit() {
        return limit;
    }

    /**
     * Get the OFFSET.
     *
     * @return the offset, or null
     */
    public Long offset() {
        return offset;
    }

    private void validateModifiers() {
        requireNonNegative("LIMIT", limit);
        requireNonNegative("OFFSET", offset);
        if (groupBy == null || orderBy == null) {
            return;
        }
        Set<Variable> available = new HashSet<>(groupBy.variables());
        for (Aggregation aggregation : aggregations) {
            available.add(aggregation.alias());
        }
        for (Variable variable : orderBy.variables()) {
            if (!available.contains(variable)) {
                throw new OrderByValidationException(
                    "ORDER BY variable " + variable
                        + " is neither grouped nor an aggregation alias");
            }
        }
    }

    private static Long requireNonNegative(final String clause, final Long value) {
        if (value != null && value < 0) {
            throw new QueryValidationException(clause + " cannot be negative: " + value);
        }
        return value;
    }

    /**
     * Builder for {@link SelectQuery} instances.
     */
    public static final class Builder {
        /** Projected variables. */
        private final List<Variable> projection = new ArrayList<>();
        /** Aggregate projections. */
        private final List<Aggregation> aggregations = new ArrayList<>();
        /** DISTINCT flag. */
        private boolean distinct;
        /** FROM graph. */
        private String from;
        /** Where-clause siblings. */
        private final List<Pattern> where = new ArrayList<>();
        /** Top-level filters. */
        private final List<Filter> filters = new ArrayList<>();
        /** GROUP BY clause. */
        private GroupBy groupBy;
        /** HAVING conditions. */
        private final List<Having> having = new ArrayList<>();
        /** ORDER BY clause. */
        private OrderBy orderBy;
        /** LIMIT. */
        private Long limit;
        /** OFFSET. */
        private Long offset;

        private Builder() {
            // Use SelectQuery.builder()
        }

        /**
         * Project the given variables. Omit for {@code SELECT *}.
         *
         * @param variables variable text such as {@code ?x}
         * @return this builder
         */
        public Builder select(final String... variables) {
            for (String variable : variables) {
                if (!"*".equals(variable)) {
                    projection.add(Variable.of(variable));
                }
            }
            return this;
        }

        /**
         * Project the given variables.
         *
         * @param variables the variables
         * @return this builder
         */
        public Builder select(final List<Variable> variables) {
            projection.addAll(variables);
            return this;
        }

        /**
         * Add an aggregate projection.
         *
         * @param aggregation the aggregation
         * @return this builder
         */
        public Builder aggregate(final Aggregation aggregation) {
            aggregations.add(aggregation);
            return this;
        }

        /**
         * Set DISTINCT.
         *
         * @param value whether DISTINCT applies
         * @return this builder
         */
        public Builder distinct(final boolean value) {
            this.distinct = value;
            return this;
        }

        /**
         * Set the FROM graph.
         *
         * @param graphIri graph IRI without brackets
         * @return this builder
         */
        public Builder from(final String graphIri) {
            this.from = graphIri;
            return this;
        }

        /**
         * Append where-clause patterns.
         *
         * @param patterns the patterns
         * @return this builder
         */
        public Builder where(final Pattern... patterns) {
            for (Pattern pattern : patterns) {
                where.add(pattern);
            }
            return this;
        }

        /**
         * Append where-clause patterns.
         *
         * @param patterns the patterns
         * @return this builder
         */
        public Builder where(final List<Pattern> patterns) {
            where.addAll(patterns);
            return this;
        }

        /**
         * Add a top-level filter.
         *
         * @param filter the filter
         * @return this builder
         */
        public Builder filter(final Filter filter) {
            filters.add(filter);
            return this;
        }

        /**
         * Set the GROUP BY clause.
         *
         * @param value the clause
         * @return this builder
         */
        public Builder groupBy(final GroupBy value) {
            this.groupBy = value;
            return this;
        }

        /**
         * Add a HAVING condition.
         *
         * @param condition the condition
         * @return this builder
         */
        public Builder having(final Having condition) {
            having.add(condition);
            return this;
        }

        /**
         * Set the ORDER BY clause.
         *
         * @param value the clause
         * @return this builder
         */
        public Builder orderBy(final OrderBy value) {
            this.orderBy = value;
            return this;
        }

        /**
         * Set the LIMIT.
         *
         * @param value the limit
         * @return this builder
         */
        public Builder limit(final long value) {
            this.limit = value;
            return this;
        }

        /**
         * Set the OFFSET.
         *
         * @param value the offset
         * @return this builder
         */
        public Builder offset(final long value) {
            this.offset = value;
            return this;
        }

        /**
         * Build the query.
         *
         * @return the query
         * @throws QueryValidationException if the modifiers are inconsistent
         */
        public SelectQuery build() {
            return new SelectQuery(this);
        }
    }
}
