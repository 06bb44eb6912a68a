package com.chronoplan.dispatch.api;

import com.chronoplan.core.model.Project;
import com.chronoplan.core.model.ResourcePoolItem;
import com.chronoplan.core.model.ScheduleEdge;
import com.chronoplan.core.model.Task;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/schedule/optimize.
 *
 * @param project      the project being optimized; nullable
 * @param tasks        the project's task plan
 * @param resourcePool shared resources
 * @param strategy     smoothing or leveling; nullable, defaults to engine configuration
 * @param edges        explicit precedence edges between tasks; nullable
 */
public record OptimizeRequest(
    Project project,
    List<Task> tasks,
    @JsonProperty("resource_pool") List<ResourcePoolItem> resourcePool,
    String strategy,
    List<ScheduleEdge> edges
) {}
