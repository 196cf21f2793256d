package com.querysmith.model;

/**
 * A node of a where-clause pattern tree.
 */
public sealed interface Pattern
    permits BasicGraphPattern, UnionPattern, OptionalPattern, GroupPattern, SubQueryPattern {

    /**
     * Get the kind tag of this node.
     *
     * @return the kind
     */
    PatternKind kind();

    /**
     * Create a deep copy of this pattern and its children.
     *
     * @return the copy
     */
    Pattern copy();
}
