package com.search.negatives.core;

import com.search.negatives.exception.ComputationTimeoutException;

import java.time.Duration;

/**
 * Cooperative cancellation signal with an optional wall-clock deadline.
 *
 * <p>Long-running loops call {@link #throwIfCancelled(String)} between records or
 * candidates. The check is cheap: a volatile read, one {@code nanoTime()} call and
 * the interrupt flag. A cancelled unit therefore stops at a record boundary and
 * never publishes a half-built result.</p>
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken(null);

    private final Duration timeout;
    private final long deadlineNanos;
    private volatile boolean cancelled;

    private CancellationToken(Duration timeout) {
        this.timeout = timeout;
        this.deadlineNanos = timeout != null ? System.nanoTime() + timeout.toNanos() : Long.MAX_VALUE;
    }

    /**
     * A token that is never cancelled. Cancelling it has no effect.
     */
    public static CancellationToken none() {
        return NONE;
    }

    /**
     * A token that expires {@code timeout} after creation.
     */
    public static CancellationToken withTimeout(Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        return new CancellationToken(timeout);
    }

    /**
     * Requests cancellation. Idempotent.
     */
    public void cancel() {
        if (this != NONE) {
            cancelled = true;
        }
    }

    public boolean isCancelled() {
        return cancelled
                || (timeout != null && System.nanoTime() - deadlineNanos >= 0)
                || Thread.currentThread().isInterrupted();
    }

    /**
     * Throws if the token was cancelled, the deadline passed, or the current thread
     * was interrupted.
     *
     * @param stage pipeline stage, used in the error message
     * @throws ComputationTimeoutException when cancelled
     */
    public void throwIfCancelled(String stage) {
        if (isCancelled()) {
            throw new ComputationTimeoutException("Cancelled during " + stage
                    + (timeout != null ? " (budget " + timeout.toMillis() + " ms)" : ""), timeout);
        }
    }

    /**
     * Remaining time before the deadline, or {@code null} when the token has none.
     */
    public Duration remaining() {
        if (timeout == null) {
            return null;
        }
        long left = deadlineNanos - System.nanoTime();
        return left > 0 ? Duration.ofNanos(left) : Duration.ZERO;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
