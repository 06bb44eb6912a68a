package com.chronoplan.core.model;

/**
 * Units of one resource a project claims during a month.
 */
public record ProjectAllocation(String projectId, String projectName, int allocation) {}
