package com.chronoplan.dispatch.api;

import com.chronoplan.core.model.Project;
import com.chronoplan.core.model.ResourcePoolItem;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/schedule/capacity.
 *
 * @param projects     current portfolio
 * @param resourcePool shared resources with capacities
 * @param candidate    optional project to check against the portfolio before adding it
 */
public record CapacityRequest(
    List<Project> projects,
    @JsonProperty("resource_pool") List<ResourcePoolItem> resourcePool,
    Project candidate
) {}
