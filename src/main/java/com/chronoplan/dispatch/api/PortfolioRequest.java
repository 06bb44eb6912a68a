package com.chronoplan.dispatch.api;

import com.chronoplan.core.model.DependencyEdge;
import com.chronoplan.core.model.Project;

import java.util.List;

/**
 * Inbound JSON body for the portfolio-level endpoints (dependencies, dependency-stats).
 *
 * @param projects     full project list
 * @param dependencies previously inferred edges; nullable, inferred when absent
 */
public record PortfolioRequest(
    List<Project> projects,
    List<DependencyEdge> dependencies
) {}
