package com.chronoplan.core.engine;

/**
 * Thrown when a {@link CancellationToken} is observed as cancelled mid-computation.
 */
public class ScheduleCancelledException extends RuntimeException {
    public ScheduleCancelledException(String message) {
        super(message);
    }
}
