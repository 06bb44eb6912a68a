package com.chronoplan.core.engine;

/**
 * Cooperative cancellation flag checked at the natural iteration boundaries of the
 * optimizer's day loop and the delay propagator's traversal.
 */
public final class CancellationToken {

    /** A token that is never cancelled. */
    public static final CancellationToken NONE = new CancellationToken();

    private volatile boolean cancelled;

    public void cancel() {
        if (this == NONE) {
            throw new UnsupportedOperationException("The shared NONE token cannot be cancelled");
        }
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void throwIfCancelled(String operation) {
        if (cancelled) {
            throw new ScheduleCancelledException(operation + " was cancelled");
        }
    }
}
