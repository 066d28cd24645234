package com.devflow.core.process;

import java.util.function.IntConsumer;

/**
 * Produces progress percentages for a running process.
 * <p>
 * The runner opens one {@link Tracker} per execution, feeds it output chunks, and closes
 * it when the execution leaves the running state. Estimates are cosmetic and never affect
 * how an execution resolves.
 */
public interface ProgressEstimator {

    /**
     * Begins estimating for a new execution.
     *
     * @param sink receives percentages in [0, 100]
     */
    Tracker begin(IntConsumer sink);

    interface Tracker extends AutoCloseable {

        /** Called for every stdout/stderr chunk the process emits. */
        default void onOutput(String chunk) {}

        /** Stops estimating. Idempotent. */
        @Override
        void close();
    }

    /** An estimator that never reports progress. */
    static ProgressEstimator none() {
        return sink -> () -> {};
    }
}
