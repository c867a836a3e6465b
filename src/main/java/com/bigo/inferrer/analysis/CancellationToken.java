package com.bigo.inferrer.analysis;

import java.time.Duration;

/**
 * Cooperative cancellation flag, checked between top-level statements and
 * between functions. Optionally carries a wall-clock deadline.
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken(Long.MAX_VALUE);

    private final long deadlineNanos;
    private volatile boolean cancelled;

    private CancellationToken(long deadlineNanos) {
        this.deadlineNanos = deadlineNanos;
    }

    /**
     * A token that can be cancelled explicitly and never expires.
     */
    public static CancellationToken create() {
        return new CancellationToken(Long.MAX_VALUE);
    }

    /**
     * A token that is never cancelled.
     */
    public static CancellationToken none() {
        return NONE;
    }

    /**
     * A token that expires once {@code budget} has elapsed.
     */
    public static CancellationToken withTimeout(Duration budget) {
        return new CancellationToken(System.nanoTime() + budget.toNanos());
    }

    public void cancel() {
        if (this == NONE) {
            throw new IllegalStateException("The shared no-op token cannot be cancelled");
        }
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled || (deadlineNanos != Long.MAX_VALUE && System.nanoTime() - deadlineNanos >= 0);
    }

    /**
     * @throws AnalysisCancelledException If the token has been cancelled or its deadline passed
     */
    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new AnalysisCancelledException(cancelled ? "Analysis cancelled" : "Analysis time budget exceeded");
        }
    }
}
