package com.querysmith.analysis;

/**
 * Shape of the subject-object graph of a basic graph pattern.
 */
public enum BgpShape {
    /** No triple patterns. */
    EMPTY("Empty"),
    /** Exactly one triple pattern. */
    SINGLE_TRIPLE("Single-triple"),
    /** A linear chain. */
    PATH("Path"),
    /** One centre joined to leaves only. */
    STAR("Star"),
    /** A single directed cycle through every node. */
    CYCLE("Cycle"),
    /** Connected and acyclic, with branching. */
    TREE("Tree"),
    /** A star with exactly one stem path of two or more nodes. */
    FLOWER("Flower"),
    /** Anything else, including disconnected and multi-cycle graphs. */
    COMPLEX("Complex");

    /** Display name. */
    private final String label;

    BgpShape(final String label) {
        this.label = label;
    }

    /**
     * Get the display name.
     *
     * @return e.g. {@code Single-triple}
     */
    public String label() {
        return label;
    }
}
