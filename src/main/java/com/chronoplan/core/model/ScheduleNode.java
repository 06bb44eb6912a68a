package com.chronoplan.core.model;

/**
 * A weighted node handed to the critical path analyzer.
 *
 * @param id       task or project id
 * @param duration weight in days
 * @param release  earliest offset (days from the schedule origin) the node may start at
 */
public record ScheduleNode(String id, long duration, long release) {

    public ScheduleNode(String id, long duration) {
        this(id, duration, 0L);
    }
}
