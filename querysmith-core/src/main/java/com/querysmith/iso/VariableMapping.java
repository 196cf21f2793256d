package com.querysmith.iso;

import com.querysmith.model.Variable;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Partial injective mapping from the variables of one pattern to the
 * variables of another, with an undo log.
 *
 * <p>Bindings are never overwritten: binding a variable that already has a
 * different image, or binding to an image already taken, fails. Tentative
 * bindings are scoped by a {@link Checkpoint}; closing a checkpoint that was
 * not committed undoes every binding made since it was opened.</p>
 *
 * <pre>{@code
 * try (VariableMapping.Checkpoint checkpoint = mapping.checkpoint()) {
 *     if (mapping.bind(x, y) && rest()) {
 *         checkpoint.commit();
 *         return true;
 *     }
 * }
 * // x is unbound again unless rest() succeeded
 * }</pre>
 */
final class VariableMapping {

    /** Source to target. */
    private final Map<Variable, Variable> forward = new HashMap<>();

    /** Target to source. */
    private final Map<Variable, Variable> reverse = new HashMap<>();

    /** Source variables in binding order, newest last. */
    private final Deque<Variable> log = new ArrayDeque<>();

    /**
     * Bind a source variable to a target variable.
     *
     * @param source variable of the left pattern
     * @param target variable of the right pattern
     * @return true if the binding is consistent with the mapping (possibly
     *         because it already existed), false if it contradicts it
     */
    boolean bind(final Variable source, final Variable target) {
        Variable image = forward.get(source);
        if (image != null) {
            return image.equals(target);
        }
        if (reverse.containsKey(target)) {
            return false;
        }
        forward.put(source, target);
        reverse.put(target, source);
        log.addLast(source);
        return true;
    }

    /**
     * Open a scope for tentative bindings.
     *
     * @return the checkpoint
     */
    Checkpoint checkpoint() {
        return new Checkpoint(log.size());
    }

    /**
     * Get the number of bound variables.
     *
     * @return the mapping size
     */
    int size() {
        return forward.size();
    }

    /**
     * Snapshot the mapping in binding order.
     *
     * @return an unmodifiable copy
     */
    Map<Variable, Variable> snapshot() {
        Map<Variable, Variable> copy = new LinkedHashMap<>();
        for (Variable source : log) {
            copy.put(source, forward.get(source));
        }
        return Collections.unmodifiableMap(copy);
    }

    private void rollback(final int mark) {
        while (log.size() > mark) {
            Variable source = log.removeLast();
            reverse.remove(forward.remove(source));
        }
    }

    /**
     * Scope of tentative bindings, undone on {@link #close()} unless
     * {@link #commit()} was called.
     */
    final class Checkpoint implements AutoCloseable {

        /** Log size when the checkpoint was opened. */
        private final int mark;

        /** Whether the bindings made in this scope are kept. */
        private boolean committed;

        private Checkpoint(final int mark) {
            this.mark = mark;
        }

        /**
         * Keep the bindings made in this scope.
         */
        void commit() {
            committed = true;
        }

        @Override
        public void close() {
            if (!committed) {
                rollback(mark);
            }
        }
    }
}
