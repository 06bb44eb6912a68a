package com.chronoplan.core.model;

/**
 * Dependency graph summary for reporting.
 *
 * @param totalDependencies    number of edges
 * @param criticalDependencies edges flagged as on the critical path
 * @param mostDependent        project targeted by the most edges; null when no edges
 * @param mostBlocking         project sourcing the most edges; null when no edges
 */
public record DependencyStats(
    int totalDependencies,
    int criticalDependencies,
    ProjectCount mostDependent,
    ProjectCount mostBlocking
) {

    public record ProjectCount(String id, String name, int count) {}
}
