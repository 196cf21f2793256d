package com.querysmith.iso;

/**
 * Outcome of an isomorphism check.
 */
public enum Verdict {
    /** A witness mapping was found. */
    ISOMORPHIC,
    /** The search space was exhausted without a witness. */
    NOT_ISOMORPHIC,
    /** The search budget ran out before a decision. */
    INDETERMINATE
}
