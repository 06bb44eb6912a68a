package com.chronoplan.core.model;

/**
 * Task priority, declared highest to lowest.
 * <p>
 * Conflict resolution moves lower-priority tasks first, so {@link #isLowerThan(Priority)}
 * is the comparison the optimizer relies on.
 */
public enum Priority {
    P0,
    P1,
    P2;

    public boolean isLowerThan(Priority other) {
        return this.ordinal() > other.ordinal();
    }
}
