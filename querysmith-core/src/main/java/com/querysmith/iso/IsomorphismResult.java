package com.querysmith.iso;

import com.querysmith.model.Variable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Result of an isomorphism check.
 *
 * @param verdict the outcome
 * @param mapping the witness mapping from left to right variables, in binding
 *                order; empty unless the verdict is {@link Verdict#ISOMORPHIC}
 * @param steps number of candidate pairings tried
 */
public record IsomorphismResult(Verdict verdict, Map<Variable, Variable> mapping, long steps) {

    /**
     * Creates a result.
     *
     * @param verdict the outcome
     * @param mapping the witness mapping
     * @param steps candidate pairings tried
     */
    public IsomorphismResult {
        mapping = verdict == Verdict.ISOMORPHIC
            ? Collections.unmodifiableMap(new LinkedHashMap<>(mapping))
            : Map.of();
    }

    /**
     * Check if the patterns were found isomorphic.
     *
     * @return true only for {@link Verdict#ISOMORPHIC}
     */
    public boolean isIsomorphic() {
        return verdict == Verdict.ISOMORPHIC;
    }

    /**
     * Get the witness mapping when there is one.
     *
     * @return the mapping, or empty if not isomorphic
     */
    public Optional<Map<Variable, Variable>> witness() {
        return isIsomorphic() ? Optional.of(mapping) : Optional.empty();
    }
}
