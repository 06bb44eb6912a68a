package com.chronoplan.core.model;

import java.time.YearMonth;
import java.util.List;

/**
 * A month in which the resource requirements of overlapping projects exceed a pooled
 * resource's capacity.
 *
 * @param resourceId          the over-allocated resource
 * @param resourceName        resource display name
 * @param period              the calendar month
 * @param capacity            units available
 * @param allocated           units required by the overlapping projects
 * @param conflictingProjects every project contributing to {@code allocated}, in portfolio order
 */
public record CapacityConflict(
    String resourceId,
    String resourceName,
    YearMonth period,
    int capacity,
    int allocated,
    List<ProjectAllocation> conflictingProjects
) {

    public int overallocation() {
        return allocated - capacity;
    }

    public boolean involves(String projectId) {
        return conflictingProjects.stream().anyMatch(a -> a.projectId().equals(projectId));
    }
}
