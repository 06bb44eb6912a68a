package com.chronoplan.core.model;

/**
 * A shared resource with a fixed daily capacity.
 *
 * @param id            resource identifier, matched against {@link Task#assignee()}
 * @param name          display name
 * @param totalQuantity units available on any given day, shared across all projects
 */
public record ResourcePoolItem(String id, String name, int totalQuantity) {}
