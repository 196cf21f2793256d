package com.querysmith.model;

/**
 * An OPTIONAL pattern, left-joined onto the patterns that precede it.
 */
public final class OptionalPattern implements Pattern {

    /** The optionally matched pattern; null while being built. */
    private Pattern pattern;

    /**
     * Creates an OPTIONAL with no content yet.
     */
    public OptionalPattern() {
        // Content set later
    }

    /**
     * Creates an OPTIONAL around a pattern.
     *
     * @param pattern the optionally matched pattern
     */
    public OptionalPattern(final Pattern pattern) {
        this.pattern = pattern;
    }

    @Override
    public PatternKind kind() {
        return PatternKind.OPTIONAL;
    }

    /**
     * Get the wrapped pattern.
     *
     * @return the wrapped pattern, or null if not set
     */
    public Pattern pattern() {
        return pattern;
    }

    /**
     * Set the wrapped pattern.
     *
     * @param value the new pattern
     * @return this OPTIONAL
     */
    public OptionalPattern pattern(final Pattern value) {
        this.pattern = value;
        return this;
    }

    @Override
    public OptionalPattern copy() {
        return new OptionalPattern(pattern == null ? null : pattern.copy());
    }

    @Override
    public String toString() {
        return "OPTIONAL(" + pattern + ")";
    }
}
