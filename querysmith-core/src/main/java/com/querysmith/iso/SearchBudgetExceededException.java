package com.querysmith.iso;

/**
 * Thrown when an isomorphism search tries more candidate pairings than its
 * configured budget allows. The comparison is then undecided, neither true
 * nor false.
 */
public class SearchBudgetExceededException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** The budget that was exceeded. */
    private final long maxSteps;

    /**
     * Constructs a new SearchBudgetExceededException.
     *
     * @param maxSteps the budget that was exceeded
     */
    public SearchBudgetExceededException(final long maxSteps) {
        super("Isomorphism search exceeded its budget of " + maxSteps + " steps");
        this.maxSteps = maxSteps;
    }

    /**
     * Get the exceeded budget.
     *
     * @return the maximum number of steps
     */
    public long getMaxSteps() {
        return maxSteps;
    }
}
