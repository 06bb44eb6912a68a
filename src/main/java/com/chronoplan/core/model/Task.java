package com.chronoplan.core.model;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * A schedulable unit of work inside a project.
 *
 * @param id           unique identifier within the project (e.g., "T-001")
 * @param name         display name
 * @param startDate    first calendar day the task occupies
 * @param endDate      last calendar day the task occupies (inclusive)
 * @param assignee     resource id the task consumes one unit of on each covered day
 * @param priority     P0 (highest) to P2 (lowest)
 * @param dependencies ids of predecessor tasks; nullable or empty when none are declared
 */
public record Task(
    String id,
    String name,
    LocalDate startDate,
    LocalDate endDate,
    String assignee,
    Priority priority,
    List<String> dependencies
) {

    public Task(String id, String name, LocalDate startDate, LocalDate endDate,
                String assignee, Priority priority) {
        this(id, name, startDate, endDate, assignee, priority, List.of());
    }

    /** Whole calendar days between start and end. */
    public long duration() {
        return ChronoUnit.DAYS.between(startDate, endDate);
    }

    public boolean covers(LocalDate date) {
        return !date.isBefore(startDate) && !date.isAfter(endDate);
    }

    public boolean hasDependencies() {
        return dependencies != null && !dependencies.isEmpty();
    }

    /** Returns a copy translated by {@code days}; duration is preserved. */
    public Task shiftedBy(long days) {
        return new Task(id, name, startDate.plusDays(days), endDate.plusDays(days),
                assignee, priority, dependencies);
    }
}
