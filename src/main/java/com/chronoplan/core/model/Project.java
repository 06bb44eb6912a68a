package com.chronoplan.core.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * A project in the portfolio. Budget fields are carried through untouched.
 *
 * @param id                   unique identifier (e.g., "PRJ-01")
 * @param name                 display name
 * @param startDate            planned start
 * @param endDate              planned end (inclusive)
 * @param status               lifecycle status
 * @param budget               approved budget; nullable
 * @param actualCost           cost incurred so far; nullable
 * @param resourceRequirements ordered resource demands
 * @param tasks                tasks owned by the project
 */
public record Project(
    String id,
    String name,
    LocalDate startDate,
    LocalDate endDate,
    ProjectStatus status,
    BigDecimal budget,
    BigDecimal actualCost,
    List<ResourceRequirement> resourceRequirements,
    List<Task> tasks
) {

    public Project(String id, String name, LocalDate startDate, LocalDate endDate,
                   ProjectStatus status, List<ResourceRequirement> resourceRequirements) {
        this(id, name, startDate, endDate, status, null, null, resourceRequirements, List.of());
    }

    public long duration() {
        return ChronoUnit.DAYS.between(startDate, endDate);
    }

    public List<ResourceRequirement> requirementsOrEmpty() {
        return resourceRequirements != null ? resourceRequirements : List.of();
    }

    public List<Task> tasksOrEmpty() {
        return tasks != null ? tasks : List.of();
    }

    public Project withTasks(List<Task> newTasks) {
        return new Project(id, name, startDate, endDate, status, budget, actualCost,
                resourceRequirements, newTasks);
    }
}
