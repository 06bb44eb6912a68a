package com.chronoplan.core.scheduler;

import com.chronoplan.core.engine.CancellationToken;
import com.chronoplan.core.engine.EngineProperties;
import com.chronoplan.core.graph.CriticalPathAnalyzer;
import com.chronoplan.core.model.CriticalPathResult;
import com.chronoplan.core.model.OptimizationMetrics;
import com.chronoplan.core.model.OptimizationResult;
import com.chronoplan.core.model.OptimizationStrategy;
import com.chronoplan.core.model.Priority;
import com.chronoplan.core.model.Project;
import com.chronoplan.core.model.ResourceConflict;
import com.chronoplan.core.model.ResourcePoolItem;
import com.chronoplan.core.model.ScheduleEdge;
import com.chronoplan.core.model.Task;
import com.chronoplan.core.model.TaskChange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * Resolves resource over-allocation by simulating the schedule one day at a time.
 * <p>
 * On each day, every pooled resource whose active tasks exceed its capacity has one task
 * shifted by a single day per unit of overload. Candidates are ordered non-critical before
 * critical, then lowest priority first, keeping start-date order for ties. Criticality and
 * slack come from one critical path analysis of the initial plan and are not recomputed.
 * <p>
 * SMOOTHING only shifts a task while it has slack left, consuming one day of slack per
 * shift, so the project end never moves. LEVELING always shifts and extends the tracked
 * project end when a shifted task runs past it.
 * <p>
 * The simulation is bounded by {@code 2 * originalDuration + simulationPaddingDays} days.
 * <p>
 * {@code conflictsResolved} counts one-day shifts. It is not monotonic across strategies:
 * smoothing may spread an overlap over several slack-bearing tasks while leveling clears it
 * by dragging a single task past the others, so a smoothing run can report more shifts.
 */
@Service
public class ResourceConflictOptimizer {

    private static final Logger log = LoggerFactory.getLogger(ResourceConflictOptimizer.class);

    static final String SMOOTHING_REASON = "Resource smoothing (used available slack)";
    static final String LEVELING_REASON = "Resource leveling (resolved resource conflict)";

    private final CriticalPathAnalyzer criticalPathAnalyzer;
    private final EngineProperties properties;

    public ResourceConflictOptimizer(CriticalPathAnalyzer criticalPathAnalyzer, EngineProperties properties) {
        this.criticalPathAnalyzer = criticalPathAnalyzer;
        this.properties = properties;
    }

    public OptimizationResult optimizeSchedule(Project project, List<Task> tasks,
                                               List<ResourcePoolItem> resourcePool,
                                               OptimizationStrategy strategy) {
        return optimizeSchedule(project, tasks, resourcePool, strategy, List.of(), CancellationToken.NONE);
    }

    /**
     * Produce a conflict-reduced task plan. The given tasks are not modified.
     *
     * @param project       the project the tasks belong to (used for logging)
     * @param tasks         current task plan
     * @param resourcePool  shared resources with daily capacities
     * @param strategy      smoothing or leveling
     * @param explicitEdges precedence edges in addition to the tasks' own dependency lists
     * @param cancellation  checked once per simulated day
     * @return the new plan, the per-task changes and summary metrics
     */
    public OptimizationResult optimizeSchedule(Project project, List<Task> tasks,
                                               List<ResourcePoolItem> resourcePool,
                                               OptimizationStrategy strategy,
                                               List<ScheduleEdge> explicitEdges,
                                               CancellationToken cancellation) {
        if (tasks.isEmpty()) {
            return OptimizationResult.unchanged(tasks);
        }

        CriticalPathResult initial = criticalPathAnalyzer.computeTaskCriticalPath(tasks, explicitEdges);

        // Working copy aligned with the caller's order; processing follows start-date order
        Task[] plan = tasks.toArray(new Task[0]);
        List<Integer> processingOrder = IntStream.range(0, plan.length)
                .boxed()
                .sorted(Comparator.comparing(i -> plan[i].startDate()))
                .toList();

        Map<String, Long> remainingSlack = new HashMap<>();
        for (Task task : plan) {
            remainingSlack.put(task.id(), initial.slackOf(task.id()));
        }

        LocalDate projectStart = tasks.stream().map(Task::startDate).min(Comparator.naturalOrder()).orElseThrow();
        LocalDate originalEnd = tasks.stream().map(Task::endDate).max(Comparator.naturalOrder()).orElseThrow();
        long originalDuration = ChronoUnit.DAYS.between(projectStart, originalEnd);
        long maxDays = originalDuration * 2 + properties.getSimulationPaddingDays();

        log.info("Optimizing {} task(s) for project {} with {} (critical path: {})",
                plan.length, project != null ? project.id() : "-", strategy, initial.criticalPath());

        LocalDate trackedEnd = originalEnd;
        Set<String> visited = new HashSet<>();
        int conflictsResolved = 0;
        int peakOverload = 0;

        LocalDate current = projectStart;
        for (long day = 0; day < maxDays; day++, current = current.plusDays(1)) {
            cancellation.throwIfCancelled("Schedule optimization");

            if (current.isAfter(trackedEnd)) {
                if (strategy == OptimizationStrategy.SMOOTHING) break;
                if (visited.size() == plan.length) break;
            }

            for (int i : processingOrder) {
                if (plan[i].covers(current)) {
                    visited.add(plan[i].id());
                }
            }

            for (ResourcePoolItem resource : resourcePool) {
                final LocalDate today = current;
                List<Integer> active = new ArrayList<>();
                for (int i : processingOrder) {
                    if (resource.id().equals(plan[i].assignee()) && plan[i].covers(today)) {
                        active.add(i);
                    }
                }

                int overload = active.size() - resource.totalQuantity();
                if (overload <= 0) continue;
                peakOverload = Math.max(peakOverload, overload);

                active.sort(resolutionOrder(plan, initial));

                int resolved = 0;
                for (int i : active) {
                    if (resolved >= overload) break;
                    Task task = plan[i];
                    Task shifted = task.shiftedBy(1);

                    if (strategy == OptimizationStrategy.SMOOTHING) {
                        long slack = remainingSlack.get(task.id());
                        if (slack <= 0 || shifted.endDate().isAfter(trackedEnd)) {
                            continue;
                        }
                        remainingSlack.put(task.id(), slack - 1);
                    } else if (shifted.endDate().isAfter(trackedEnd)) {
                        trackedEnd = shifted.endDate();
                    }

                    plan[i] = shifted;
                    resolved++;
                    conflictsResolved++;
                }

                log.debug("{} {}: {} active, capacity {}, shifted {}",
                        today, resource.id(), active.size(), resource.totalQuantity(), resolved);
            }
        }

        String reason = strategy == OptimizationStrategy.SMOOTHING ? SMOOTHING_REASON : LEVELING_REASON;
        var changes = new ArrayList<TaskChange>();
        for (int i = 0; i < plan.length; i++) {
            Task original = tasks.get(i);
            Task updated = plan[i];
            if (!original.startDate().equals(updated.startDate())) {
                changes.add(new TaskChange(
                        updated.id(),
                        updated.name(),
                        original.startDate(),
                        updated.startDate(),
                        ChronoUnit.DAYS.between(original.startDate(), updated.startDate()),
                        reason));
            }
        }

        var metrics = new OptimizationMetrics(
                originalDuration,
                ChronoUnit.DAYS.between(projectStart, trackedEnd),
                conflictsResolved,
                peakOverload);

        log.info("Optimization finished: {} conflict(s) resolved, {} task(s) moved, duration {} -> {} day(s)",
                conflictsResolved, changes.size(), metrics.originalDuration(), metrics.newDuration());
        return new OptimizationResult(List.of(plan), List.copyOf(changes), metrics);
    }

    /**
     * Report every day on which a pooled resource has more active tasks than capacity.
     *
     * @param tasks        task plan to inspect
     * @param resourcePool shared resources
     * @return conflicts ordered by date, then by pool order
     */
    public List<ResourceConflict> detectConflicts(List<Task> tasks, List<ResourcePoolItem> resourcePool) {
        if (tasks.isEmpty() || resourcePool.isEmpty()) {
            return List.of();
        }
        LocalDate first = tasks.stream().map(Task::startDate).min(Comparator.naturalOrder()).orElseThrow();
        LocalDate last = tasks.stream().map(Task::endDate).max(Comparator.naturalOrder()).orElseThrow();

        var conflicts = new ArrayList<ResourceConflict>();
        for (LocalDate day = first; !day.isAfter(last); day = day.plusDays(1)) {
            for (ResourcePoolItem resource : resourcePool) {
                final LocalDate today = day;
                List<String> active = tasks.stream()
                        .filter(t -> resource.id().equals(t.assignee()) && t.covers(today))
                        .map(Task::id)
                        .toList();
                if (active.size() > resource.totalQuantity()) {
                    conflicts.add(new ResourceConflict(resource.id(), resource.name(), today,
                            resource.totalQuantity(), active.size(), active));
                }
            }
        }
        log.debug("Detected {} resource conflict day(s) across {} task(s)", conflicts.size(), tasks.size());
        return conflicts;
    }

    private static Comparator<Integer> resolutionOrder(Task[] plan, CriticalPathResult criticalPath) {
        Comparator<Integer> nonCriticalFirst = Comparator.comparing(i -> criticalPath.isCritical(plan[i].id()));
        Comparator<Integer> lowerPriorityFirst = (a, b) -> compareLowerFirst(plan[a].priority(), plan[b].priority());
        return nonCriticalFirst.thenComparing(lowerPriorityFirst);
    }

    /** Negative when {@code a} should move before {@code b}; a missing priority moves first. */
    private static int compareLowerFirst(Priority a, Priority b) {
        if (a == b) return 0;
        if (a == null) return -1;
        if (b == null) return 1;
        return a.isLowerThan(b) ? -1 : 1;
    }
}
