package com.chronoplan.dispatch.api;

import com.chronoplan.core.model.ScheduleEdge;
import com.chronoplan.core.model.ScheduleNode;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/schedule/critical-path.
 *
 * @param nodes weighted nodes
 * @param edges precedence edges; nullable
 */
public record CriticalPathRequest(
    List<ScheduleNode> nodes,
    List<ScheduleEdge> edges
) {}
