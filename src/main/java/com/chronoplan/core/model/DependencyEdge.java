package com.chronoplan.core.model;

import java.time.Instant;

/**
 * An inferred project-to-project dependency.
 *
 * @param id                stable identifier, {@code dep-<source>-<target>}
 * @param sourceProjectId   upstream project
 * @param sourceProjectName upstream project name
 * @param targetProjectId   downstream project
 * @param targetProjectName downstream project name
 * @param type              date relationship
 * @param description       why the dependency was inferred
 * @param criticalPath      true when the edge lies on the portfolio critical path
 * @param status            lifecycle status
 * @param createdAt         when the edge was inferred
 */
public record DependencyEdge(
    String id,
    String sourceProjectId,
    String sourceProjectName,
    String targetProjectId,
    String targetProjectName,
    DependencyType type,
    String description,
    boolean criticalPath,
    DependencyStatus status,
    Instant createdAt
) {

    public DependencyEdge withCriticalPath(boolean critical) {
        return new DependencyEdge(id, sourceProjectId, sourceProjectName, targetProjectId,
                targetProjectName, type, description, critical, status, createdAt);
    }

    public ScheduleEdge toScheduleEdge() {
        return new ScheduleEdge(sourceProjectId, targetProjectId);
    }
}
