package com.chronoplan.core.model;

import java.time.LocalDate;
import java.util.List;

/**
 * A single day on which a resource is over-allocated.
 *
 * @param resourceId   the over-allocated resource
 * @param resourceName resource display name
 * @param date         the day of the conflict
 * @param capacity     units available
 * @param allocated    units demanded by active tasks
 * @param taskIds      tasks competing for the resource that day
 */
public record ResourceConflict(
    String resourceId,
    String resourceName,
    LocalDate date,
    int capacity,
    int allocated,
    List<String> taskIds
) {

    public int overload() {
        return allocated - capacity;
    }
}
