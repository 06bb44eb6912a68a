package com.chronoplan.core.model;

import java.util.List;
import java.util.Optional;

/**
 * Snapshot of a portfolio as ingested from JSON.
 *
 * @param projects     all projects, any status
 * @param resourcePool shared resources
 * @param dependencies previously inferred edges; nullable, rebuilt when absent
 */
public record Portfolio(
    List<Project> projects,
    List<ResourcePoolItem> resourcePool,
    List<DependencyEdge> dependencies
) {

    public List<Project> projectsOrEmpty() {
        return projects != null ? projects : List.of();
    }

    public List<ResourcePoolItem> resourcePoolOrEmpty() {
        return resourcePool != null ? resourcePool : List.of();
    }

    public Optional<List<DependencyEdge>> declaredDependencies() {
        return dependencies == null || dependencies.isEmpty() ? Optional.empty() : Optional.of(dependencies);
    }

    public Optional<Project> findProject(String projectId) {
        return projectsOrEmpty().stream().filter(p -> p.id().equals(projectId)).findFirst();
    }
}
