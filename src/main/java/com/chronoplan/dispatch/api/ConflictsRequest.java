package com.chronoplan.dispatch.api;

import com.chronoplan.core.model.ResourcePoolItem;
import com.chronoplan.core.model.Task;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/schedule/conflicts.
 */
public record ConflictsRequest(
    List<Task> tasks,
    @JsonProperty("resource_pool") List<ResourcePoolItem> resourcePool
) {}
