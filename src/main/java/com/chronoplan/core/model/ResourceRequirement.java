package com.chronoplan.core.model;

/**
 * A project's demand on a pooled resource.
 *
 * @param resourceId id of the {@link ResourcePoolItem} required
 * @param count      number of units required
 */
public record ResourceRequirement(String resourceId, int count) {}
