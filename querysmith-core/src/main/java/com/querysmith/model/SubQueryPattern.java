package com.querysmith.model;

/**
 * A nested SELECT used as a pattern.
 */
public final class SubQueryPattern implements Pattern {

    /** The nested query; null while being built. */
    private SelectQuery query;

    /**
     * Creates a subquery pattern.
     *
     * @param query the nested query
     */
    public SubQueryPattern(final SelectQuery query) {
        this.query = query;
    }

    @Override
    public PatternKind kind() {
        return PatternKind.SUBQUERY;
    }

    /**
     * Get the nested query.
     *
     * @return the nested query, or null if not set
     */
    public SelectQuery query() {
        return query;
    }

    /**
     * Replace the nested query.
     *
     * @param value the new nested query
     * @return this pattern
     */
    public SubQueryPattern query(final SelectQuery value) {
        this.query = value;
        return this;
    }

    @Override
    public SubQueryPattern copy() {
        return new SubQueryPattern(query == null ? null : query.copy());
    }

    @Override
    public String toString() {
        return "SUBQUERY(" + (query == null ? null : query.where()) + ")";
    }
}
