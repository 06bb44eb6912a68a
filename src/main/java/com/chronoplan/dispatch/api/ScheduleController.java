package com.chronoplan.dispatch.api;

import com.chronoplan.core.engine.CancellationToken;
import com.chronoplan.core.engine.SchedulingEngine;
import com.chronoplan.core.model.CapacityConflict;
import com.chronoplan.core.model.CriticalPathResult;
import com.chronoplan.core.model.DependencyEdge;
import com.chronoplan.core.model.DependencyStats;
import com.chronoplan.core.model.ImpactEntry;
import com.chronoplan.core.model.OptimizationResult;
import com.chronoplan.core.model.OptimizationStrategy;
import com.chronoplan.core.model.Portfolio;
import com.chronoplan.core.model.Project;
import com.chronoplan.core.model.ResourceConflict;
import com.chronoplan.core.portfolio.InvalidPortfolioException;
import com.chronoplan.core.portfolio.PortfolioValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * REST controller exposing the scheduling engine entry points.
 * Request bodies are validated the same way portfolio files are before reaching the engine.
 */
@RestController
@RequestMapping("/api/v1/schedule")
public class ScheduleController {

    private static final Logger log = LoggerFactory.getLogger(ScheduleController.class);

    private final SchedulingEngine engine;
    private final PortfolioValidator validator;

    public ScheduleController(SchedulingEngine engine, PortfolioValidator validator) {
        this.engine = engine;
        this.validator = validator;
    }

    /**
     * POST /api/v1/schedule/critical-path: Longest path and slack over an explicit graph.
     */
    @PostMapping("/critical-path")
    public ResponseEntity<CriticalPathResult> criticalPath(@RequestBody CriticalPathRequest request) {
        return ResponseEntity.ok(engine.computeCriticalPath(
                orEmpty(request.nodes()), orEmpty(request.edges())));
    }

    /**
     * POST /api/v1/schedule/optimize: Resource smoothing or leveling of a task plan.
     */
    @PostMapping("/optimize")
    public ResponseEntity<?> optimize(@RequestBody OptimizeRequest request) {
        OptimizationStrategy strategy = null;
        if (request.strategy() != null) {
            try {
                strategy = OptimizationStrategy.fromString(request.strategy());
            } catch (IllegalArgumentException e) {
                return ResponseEntity.badRequest().body(
                        Map.of("error", "Invalid strategy: " + request.strategy()));
            }
        }

        var tasks = orEmpty(request.tasks());
        validator.validateTasks(tasks);
        validator.validate(new Portfolio(List.of(), orEmpty(request.resourcePool()), null));

        OptimizationResult result = engine.optimizeSchedule(
                request.project(), tasks, orEmpty(request.resourcePool()), strategy,
                orEmpty(request.edges()), CancellationToken.NONE);
        return ResponseEntity.ok(result);
    }

    /**
     * POST /api/v1/schedule/conflicts: Days on which a resource is over-allocated.
     */
    @PostMapping("/conflicts")
    public ResponseEntity<List<ResourceConflict>> conflicts(@RequestBody ConflictsRequest request) {
        var tasks = orEmpty(request.tasks());
        validator.validateTasks(tasks);
        validator.validate(new Portfolio(List.of(), orEmpty(request.resourcePool()), null));
        return ResponseEntity.ok(engine.detectConflicts(tasks, orEmpty(request.resourcePool())));
    }

    /**
     * POST /api/v1/schedule/capacity: Months where project requirements exceed pool capacity.
     * With a candidate, only the conflicts the candidate would take part in.
     */
    @PostMapping("/capacity")
    public ResponseEntity<List<CapacityConflict>> capacity(@RequestBody CapacityRequest request) {
        var projects = orEmpty(request.projects());
        var pool = orEmpty(request.resourcePool());
        var checked = new ArrayList<>(projects);
        if (request.candidate() != null) {
            checked.add(request.candidate());
        }
        validator.validate(new Portfolio(checked, pool, null));

        if (request.candidate() != null) {
            return ResponseEntity.ok(engine.checkProjectConflicts(request.candidate(), projects, pool));
        }
        return ResponseEntity.ok(engine.detectCapacityConflicts(projects, pool));
    }

    /**
     * POST /api/v1/schedule/dependencies: Infer cross-project dependencies.
     */
    @PostMapping("/dependencies")
    public ResponseEntity<List<DependencyEdge>> dependencies(@RequestBody PortfolioRequest request) {
        var projects = validatedProjects(request.projects());
        return ResponseEntity.ok(engine.buildDependencyGraph(projects));
    }

    /**
     * POST /api/v1/schedule/propagate: Downstream impact of delaying one project.
     */
    @PostMapping("/propagate")
    public ResponseEntity<?> propagate(@RequestBody PropagateRequest request) {
        if (request.projectId() == null || request.projectId().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "project_id is required"));
        }
        var projects = validatedProjects(request.projects());
        List<ImpactEntry> impact = engine.propagateDelay(
                request.projectId(), request.delayDays(), projects, edgesFor(projects, request.dependencies()));
        return ResponseEntity.ok(impact);
    }

    /**
     * POST /api/v1/schedule/dependency-stats: Dependency graph summary.
     */
    @PostMapping("/dependency-stats")
    public ResponseEntity<DependencyStats> dependencyStats(@RequestBody PortfolioRequest request) {
        var projects = validatedProjects(request.projects());
        return ResponseEntity.ok(engine.aggregateDependencyStats(projects, edgesFor(projects, request.dependencies())));
    }

    @ExceptionHandler(InvalidPortfolioException.class)
    public ResponseEntity<Map<String, Object>> invalidPortfolio(InvalidPortfolioException e) {
        log.info("Rejected request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of(
                "error", "Invalid portfolio",
                "violations", e.getViolations()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badArgument(IllegalArgumentException e) {
        log.info("Rejected request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(e.getMessage())));
    }

    private List<Project> validatedProjects(List<Project> projects) {
        var list = orEmpty(projects);
        validator.validate(new Portfolio(list, List.of(), null));
        return list;
    }

    private List<DependencyEdge> edgesFor(List<Project> projects, List<DependencyEdge> declared) {
        return declared != null ? declared : engine.buildDependencyGraph(projects);
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list != null ? list : List.of();
    }
}
