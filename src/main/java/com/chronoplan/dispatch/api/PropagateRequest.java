package com.chronoplan.dispatch.api;

import com.chronoplan.core.model.DependencyEdge;
import com.chronoplan.core.model.Project;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/schedule/propagate.
 *
 * @param projectId    the delayed project
 * @param delayDays    delay in days
 * @param projects     full project list
 * @param dependencies dependency edges; nullable, inferred when absent
 */
public record PropagateRequest(
    @JsonProperty("project_id") String projectId,
    @JsonProperty("delay_days") long delayDays,
    List<Project> projects,
    List<DependencyEdge> dependencies
) {}
