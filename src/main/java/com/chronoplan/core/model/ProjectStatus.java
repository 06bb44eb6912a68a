package com.chronoplan.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Lifecycle status of a project. Only {@link #PLANNING} and {@link #ACTIVE} projects
 * take part in dependency inference.
 */
public enum ProjectStatus {
    @JsonProperty("planning") PLANNING,
    @JsonProperty("active") ACTIVE,
    @JsonProperty("on-hold") ON_HOLD,
    @JsonProperty("completed") COMPLETED,
    @JsonProperty("cancelled") CANCELLED;

    public boolean isSchedulable() {
        return this == PLANNING || this == ACTIVE;
    }
}
