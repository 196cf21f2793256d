package com.querysmith.model;

/**
 * A UNION of two patterns. UNION is commutative: structural comparison
 * ignores the order of the operands.
 */
public final class UnionPattern implements Pattern {

    /** Left operand; null while the tree is being built. */
    private Pattern left;

    /** Right operand; null while the tree is being built. */
    private Pattern right;

    /**
     * Creates a UNION with no operands yet.
     */
    public UnionPattern() {
        // Operands set later
    }

    /**
     * Creates a UNION of two patterns.
     *
     * @param left the left operand
     * @param right the right operand
     */
    public UnionPattern(final Pattern left, final Pattern right) {
        this.left = left;
        this.right = right;
    }

    @Override
    public PatternKind kind() {
        return PatternKind.UNION;
    }

    /**
     * Get the left operand.
     *
     * @return the left operand, or null if not set
     */
    public Pattern left() {
        return left;
    }

    /**
     * Get the right operand.
     *
     * @return the right operand, or null if not set
     */
    public Pattern right() {
        return right;
    }

    /**
     * Set the left operand.
     *
     * @param value the new left operand
     * @return this UNION
     */
    public UnionPattern left(final Pattern value) {
        this.left = value;
        return this;
    }

    /**
     * Set the right operand.
     *
     * @param value the new right operand
     * @return this UNION
     */
    public UnionPattern right(final Pattern value) {
        this.right = value;
        return this;
    }

    @Override
    public UnionPattern copy() {
        return new UnionPattern(
            left == null ? null : left.copy(),
            right == null ? null : right.copy());
    }

    @Override
    public String toString() {
        return "UNION(" + left + ", " + right + ")";
    }
}
