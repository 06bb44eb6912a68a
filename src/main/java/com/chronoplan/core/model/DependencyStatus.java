package com.chronoplan.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum DependencyStatus {
    @JsonProperty("active") ACTIVE,
    @JsonProperty("resolved") RESOLVED,
    @JsonProperty("broken") BROKEN
}
