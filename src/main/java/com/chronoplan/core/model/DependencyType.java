package com.chronoplan.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Relationship between the dates of two dependent projects.
 */
public enum DependencyType {
    @JsonProperty("finish-to-start") FINISH_TO_START,
    @JsonProperty("start-to-start") START_TO_START,
    @JsonProperty("finish-to-finish") FINISH_TO_FINISH
}
