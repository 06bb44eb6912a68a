package com.chronoplan.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How the optimizer resolves resource over-allocation.
 * <p>
 * SMOOTHING: only consumes slack, the project end date never moves.
 * LEVELING: always shifts, extending the project end date when needed.
 */
public enum OptimizationStrategy {
    SMOOTHING,
    LEVELING;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static OptimizationStrategy fromString(String value) {
        return OptimizationStrategy.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
