package com.chronoplan.core.engine;

import com.chronoplan.core.graph.CriticalPathAnalyzer;
import com.chronoplan.core.graph.DelayPropagator;
import com.chronoplan.core.graph.DependencyGraphBuilder;
import com.chronoplan.core.graph.DependencyStatsAggregator;
import com.chronoplan.core.graph.TaskDependencyGraph;
import com.chronoplan.core.logging.MdcContext;
import com.chronoplan.core.metrics.SchedulingMetrics;
import com.chronoplan.core.model.CapacityConflict;
import com.chronoplan.core.model.CriticalPathResult;
import com.chronoplan.core.model.DependencyEdge;
import com.chronoplan.core.model.DependencyStats;
import com.chronoplan.core.model.ImpactEntry;
import com.chronoplan.core.model.OptimizationResult;
import com.chronoplan.core.model.OptimizationStrategy;
import com.chronoplan.core.model.Project;
import com.chronoplan.core.model.ResourceAvailability;
import com.chronoplan.core.model.ResourceConflict;
import com.chronoplan.core.model.ResourcePoolItem;
import com.chronoplan.core.model.ScheduleEdge;
import com.chronoplan.core.model.ScheduleNode;
import com.chronoplan.core.model.Task;
import com.chronoplan.core.scheduler.CapacityPlanner;
import com.chronoplan.core.scheduler.ResourceConflictOptimizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.YearMonth;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Entry points of the scheduling engine.
 * <p>
 * Every call is value-in/value-out: inputs are never modified and no state is kept
 * between calls, so concurrent callers need no coordination. This facade adds MDC
 * context, timing metrics and summary logging around the graph and scheduler services.
 */
@Service
public class SchedulingEngine {

    private static final Logger log = LoggerFactory.getLogger(SchedulingEngine.class);

    private final CriticalPathAnalyzer criticalPathAnalyzer;
    private final ResourceConflictOptimizer optimizer;
    private final CapacityPlanner capacityPlanner;
    private final DependencyGraphBuilder dependencyGraphBuilder;
    private final DelayPropagator delayPropagator;
    private final DependencyStatsAggregator statsAggregator;
    private final SchedulingMetrics metrics;
    private final EngineProperties properties;

    public SchedulingEngine(CriticalPathAnalyzer criticalPathAnalyzer,
                            ResourceConflictOptimizer optimizer,
                            CapacityPlanner capacityPlanner,
                            DependencyGraphBuilder dependencyGraphBuilder,
                            DelayPropagator delayPropagator,
                            DependencyStatsAggregator statsAggregator,
                            SchedulingMetrics metrics,
                            EngineProperties properties) {
        this.criticalPathAnalyzer = criticalPathAnalyzer;
        this.optimizer = optimizer;
        this.capacityPlanner = capacityPlanner;
        this.dependencyGraphBuilder = dependencyGraphBuilder;
        this.delayPropagator = delayPropagator;
        this.statsAggregator = statsAggregator;
        this.metrics = metrics;
        this.properties = properties;
    }

    // --- Critical path ---

    public CriticalPathResult computeCriticalPath(List<ScheduleNode> nodes, List<ScheduleEdge> edges) {
        return timed("critical-path", () -> recordCycles(criticalPathAnalyzer.computeCriticalPath(nodes, edges)));
    }

    public CriticalPathResult computeTaskCriticalPath(List<Task> tasks, List<ScheduleEdge> explicitEdges) {
        return timed("critical-path", () ->
                recordCycles(criticalPathAnalyzer.computeTaskCriticalPath(tasks, explicitEdges)));
    }

    public CriticalPathResult computeProjectCriticalPath(List<Project> projects, List<DependencyEdge> edges) {
        return timed("critical-path", () ->
                recordCycles(criticalPathAnalyzer.computeProjectCriticalPath(projects, edges)));
    }

    // --- Optimization ---

    public OptimizationResult optimizeSchedule(Project project, List<Task> tasks,
                                               List<ResourcePoolItem> resourcePool,
                                               OptimizationStrategy strategy) {
        return optimizeSchedule(project, tasks, resourcePool, strategy, List.of(), CancellationToken.NONE);
    }

    public OptimizationResult optimizeSchedule(Project project, List<Task> tasks,
                                               List<ResourcePoolItem> resourcePool,
                                               OptimizationStrategy strategy,
                                               List<ScheduleEdge> explicitEdges,
                                               CancellationToken cancellation) {
        OptimizationStrategy effective = strategy != null ? strategy : properties.getDefaultStrategy();
        MdcContext.setOptimization(project != null ? project.id() : "-", effective.wireName());
        try {
            long start = System.currentTimeMillis();
            OptimizationResult result = optimizer.optimizeSchedule(
                    project, tasks, resourcePool, effective, explicitEdges, cancellation);
            metrics.recordOperation("optimize", System.currentTimeMillis() - start);
            metrics.recordConflictsResolved(effective.wireName(), result.metrics().conflictsResolved());
            return result;
        } finally {
            MdcContext.clear();
        }
    }

    public List<ResourceConflict> detectConflicts(List<Task> tasks, List<ResourcePoolItem> resourcePool) {
        return timed("conflicts", () -> optimizer.detectConflicts(tasks, resourcePool));
    }

    // --- Portfolio capacity ---

    public List<CapacityConflict> detectCapacityConflicts(List<Project> projects, List<ResourcePoolItem> resourcePool) {
        return timed("capacity", () -> {
            List<CapacityConflict> conflicts = capacityPlanner.detectCapacityConflicts(projects, resourcePool);
            log.info("{} capacity conflict(s) across {} project(s)", conflicts.size(), projects.size());
            return conflicts;
        });
    }

    public List<CapacityConflict> checkProjectConflicts(Project candidate, List<Project> existing,
                                                        List<ResourcePoolItem> resourcePool) {
        MdcContext.setProject("capacity-check", candidate.id());
        try {
            long start = System.currentTimeMillis();
            List<CapacityConflict> conflicts = capacityPlanner.checkProjectConflicts(candidate, existing, resourcePool);
            metrics.recordOperation("capacity-check", System.currentTimeMillis() - start);
            return conflicts;
        } finally {
            MdcContext.clear();
        }
    }

    public List<ResourceAvailability> resourceAvailability(String resourceId, YearMonth from, YearMonth to,
                                                           List<Project> projects,
                                                           List<ResourcePoolItem> resourcePool) {
        return timed("availability", () ->
                capacityPlanner.resourceAvailability(resourceId, from, to, projects, resourcePool));
    }

    // --- Portfolio dependencies ---

    public List<DependencyEdge> buildDependencyGraph(List<Project> projects) {
        return timed("dependencies", () -> {
            List<DependencyEdge> edges = dependencyGraphBuilder.buildDependencyGraph(projects);
            metrics.recordDependenciesInferred(edges.size());
            return edges;
        });
    }

    public List<ImpactEntry> propagateDelay(String projectId, long delayDays,
                                            List<Project> projects, List<DependencyEdge> edges) {
        return propagateDelay(projectId, delayDays, projects, edges, CancellationToken.NONE);
    }

    public List<ImpactEntry> propagateDelay(String projectId, long delayDays,
                                            List<Project> projects, List<DependencyEdge> edges,
                                            CancellationToken cancellation) {
        MdcContext.setProject("propagate", projectId);
        try {
            long start = System.currentTimeMillis();
            List<ImpactEntry> impact = delayPropagator.propagateDelay(projectId, delayDays, projects, edges, cancellation);
            metrics.recordOperation("propagate", System.currentTimeMillis() - start);
            metrics.recordProjectsImpacted(impact.size());
            return impact;
        } finally {
            MdcContext.clear();
        }
    }

    public DependencyStats aggregateDependencyStats(List<Project> projects, List<DependencyEdge> edges) {
        return timed("dependency-stats", () -> statsAggregator.aggregate(projects, edges));
    }

    // --- Task dependency utilities ---

    public boolean wouldCreateCycle(List<Task> tasks, String fromTaskId, String toTaskId) {
        boolean cycle = TaskDependencyGraph.wouldCreateCycle(tasks, fromTaskId, toTaskId);
        if (cycle) {
            log.info("Rejecting dependency {} -> {}: it would create a cycle", fromTaskId, toTaskId);
        }
        return cycle;
    }

    /** Tasks moved so each starts after all of its declared predecessors end. */
    public List<Task> alignTaskDates(List<Task> tasks) {
        List<Task> aligned = TaskDependencyGraph.alignToDependencies(tasks);
        long moved = 0;
        for (int i = 0; i < tasks.size(); i++) {
            if (!tasks.get(i).startDate().equals(aligned.get(i).startDate())) moved++;
        }
        log.info("Aligned {} task(s) to their dependencies, {} moved", tasks.size(), moved);
        return aligned;
    }

    public Set<String> allPredecessors(String taskId, List<Task> tasks) {
        return TaskDependencyGraph.allPredecessors(taskId, tasks);
    }

    public Set<String> allSuccessors(String taskId, List<Task> tasks) {
        return TaskDependencyGraph.allSuccessors(taskId, tasks);
    }

    private CriticalPathResult recordCycles(CriticalPathResult result) {
        if (result.hasCycles()) {
            metrics.recordCycleDetected(result.unresolvedNodeIds().size());
        }
        return result;
    }

    private <T> T timed(String operation, Supplier<T> body) {
        MdcContext.setOperation(operation);
        long start = System.currentTimeMillis();
        try {
            return body.get();
        } finally {
            metrics.recordOperation(operation, System.currentTimeMillis() - start);
            MdcContext.clear();
        }
    }
}
