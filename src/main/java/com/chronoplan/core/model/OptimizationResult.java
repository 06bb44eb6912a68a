package com.chronoplan.core.model;

import java.util.List;

/**
 * A new task plan; the tasks handed to the optimizer are never modified.
 */
public record OptimizationResult(
    List<Task> optimizedTasks,
    List<TaskChange> changes,
    OptimizationMetrics metrics
) {

    public static OptimizationResult unchanged(List<Task> tasks) {
        return new OptimizationResult(List.copyOf(tasks), List.of(), OptimizationMetrics.none());
    }

    public boolean hasChanges() {
        return !changes.isEmpty();
    }
}
