package com.querysmith.model;

/**
 * The closed set of pattern kinds. Dispatch over patterns switches on this
 * tag, so a new kind fails compilation wherever a switch is not updated.
 */
public enum PatternKind {
    /** Basic graph pattern: triples and filters. */
    BGP,
    /** Two-branch UNION. */
    UNION,
    /** OPTIONAL wrapper. */
    OPTIONAL,
    /** Nested group {@code { ... }}. */
    GROUP,
    /** Nested SELECT. */
    SUBQUERY
}
