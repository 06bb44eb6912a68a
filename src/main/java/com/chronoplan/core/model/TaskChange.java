package com.chronoplan.core.model;

import java.time.LocalDate;

/**
 * A task the optimizer moved.
 *
 * @param taskId        task identifier
 * @param taskName      task name
 * @param originalStart start date before optimization
 * @param newStart      start date after optimization
 * @param delayDays     total shift in days
 * @param reason        strategy-specific explanation
 */
public record TaskChange(
    String taskId,
    String taskName,
    LocalDate originalStart,
    LocalDate newStart,
    long delayDays,
    String reason
) {}
