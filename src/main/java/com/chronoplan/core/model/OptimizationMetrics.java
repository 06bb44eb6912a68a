package com.chronoplan.core.model;

/**
 * Summary of an optimization run.
 *
 * @param originalDuration     days from earliest start to latest end before optimization
 * @param newDuration          days from earliest start to the tracked end after optimization
 * @param conflictsResolved    number of one-day shifts applied
 * @param peakOverloadReduced  largest single-day overload encountered
 */
public record OptimizationMetrics(
    long originalDuration,
    long newDuration,
    int conflictsResolved,
    int peakOverloadReduced
) {

    public static OptimizationMetrics none() {
        return new OptimizationMetrics(0, 0, 0, 0);
    }
}
