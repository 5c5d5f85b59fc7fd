package com.supplyplanner.solver;

import java.time.Duration;

/**
 * Iteration and wall-clock bound for one solver call. Not thread-safe; each solve owns its budget.
 */
public final class SolveBudget {
    static final int UNBOUNDED = Integer.MAX_VALUE;

    private final int maxIterations;
    private final long deadlineNanos;
    private final boolean timeBounded;
    private int iterations;
    private boolean exhausted;

    private SolveBudget(int maxIterations, Duration timeLimit) {
        this.maxIterations = normalizeBound(maxIterations);
        this.timeBounded = timeLimit != null && !timeLimit.isZero() && !timeLimit.isNegative();
        this.deadlineNanos = timeBounded ? System.nanoTime() + timeLimit.toNanos() : 0L;
    }

    /**
     * Starts the clock now. Zero or negative bounds mean unbounded.
     */
    public static SolveBudget of(int maxIterations, Duration timeLimit) {
        return new SolveBudget(maxIterations, timeLimit);
    }

    public static SolveBudget unbounded() {
        return new SolveBudget(0, null);
    }

    /**
     * Spends one iteration. Returns false, and stays exhausted, once either bound is hit.
     */
    public boolean tryConsume() {
        if (exhausted) {
            return false;
        }
        if (iterations >= maxIterations || (timeBounded && System.nanoTime() - deadlineNanos > 0)) {
            exhausted = true;
            return false;
        }
        iterations++;
        return true;
    }

    public boolean isExhausted() {
        return exhausted;
    }

    public int iterations() {
        return iterations;
    }

    private static int normalizeBound(int bound) {
        if (bound <= 0) {
            return UNBOUNDED;
        }
        return bound;
    }
}
