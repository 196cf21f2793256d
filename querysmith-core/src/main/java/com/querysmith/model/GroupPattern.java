package com.querysmith.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A nested group graph pattern {@code { ... }} holding a sequence of sibling
 * patterns.
 */
public final class GroupPattern implements Pattern {

    /** Sibling patterns, in source order. */
    private final List<Pattern> patterns = new ArrayList<>();

    /**
     * Creates an empty group.
     */
    public GroupPattern() {
        // Empty group
    }

    /**
     * Creates a group of the given patterns.
     *
     * @param patterns the sibling patterns
     */
    public GroupPattern(final List<Pattern> patterns) {
        this.patterns.addAll(patterns);
    }

    /**
     * Creates a group of the given patterns.
     *
     * @param patterns the sibling patterns
     * @return the group
     */
    public static GroupPattern of(final Pattern... patterns) {
        return new GroupPattern(List.of(patterns));
    }

    @Override
    public PatternKind kind() {
        return PatternKind.GROUP;
    }

    /**
     * Append a pattern to the group.
     *
     * @param pattern the pattern
     * @return this group
     */
    public GroupPattern add(final Pattern pattern) {
        if (pattern == null) {
            throw new InvalidPatternException("Cannot add a null pattern to a group");
        }
        patterns.add(pattern);
        return this;
    }

    /**
     * Attach a filter to the group. The filter goes on the last BGP of the
     * group; a filter-only BGP is appended if the group has no BGP.
     *
     * @param filter the filter
     * @return this group
     */
    public GroupPattern add(final Filter filter) {
        Patterns.lastBgp(patterns).add(filter);
        return this;
    }

    /**
     * Attach a filter given as expression text.
     *
     * @param expression the filter expression
     * @return this group
     */
    public GroupPattern addFilter(final String expression) {
        return add(new Filter(expression));
    }

    /**
     * Remove a pattern, compared by identity.
     *
     * @param pattern the pattern to remove
     * @return true if the pattern was a direct child
     */
    public boolean remove(final Pattern pattern) {
        return Patterns.removeByIdentity(patterns, pattern);
    }

    /**
     * Get the sibling patterns.
     *
     * @return unmodifiable view of the patterns
     */
    public List<Pattern> patterns() {
        return Collections.unmodifiableList(patterns);
    }

    @Override
    public GroupPattern copy() {
        return new GroupPattern(Patterns.copyAll(patterns));
    }

    @Override
    public String toString() {
        return "GROUP" + patterns;
    }
}
