package com.taskgraph.core.model;

import java.time.Duration;

/**
 * Options for a single submission to the solver.
 *
 * @param throwOnError raise the earliest failure once the batch has settled
 * @param deadline overall deadline for the batch, or null for none
 * @param unlimitedConcurrency let this batch's tasks bypass the global concurrency limit
 */
public record SolveOptions(
    boolean throwOnError,
    Duration deadline,
    boolean unlimitedConcurrency
) {
    public SolveOptions {
        if (deadline != null && (deadline.isNegative() || deadline.isZero())) {
            throw new IllegalArgumentException("deadline must be positive: " + deadline);
        }
    }

    public static SolveOptions defaults() {
        return new SolveOptions(false, null, false);
    }

    public SolveOptions withThrowOnError(boolean throwOnError) {
        return new SolveOptions(throwOnError, deadline, unlimitedConcurrency);
    }

    public SolveOptions withDeadline(Duration deadline) {
        return new SolveOptions(throwOnError, deadline, unlimitedConcurrency);
    }

    public SolveOptions withUnlimitedConcurrency(boolean unlimitedConcurrency) {
        return new SolveOptions(throwOnError, deadline, unlimitedConcurrency);
    }

    public boolean hasDeadline() {
        return deadline != null;
    }
}
