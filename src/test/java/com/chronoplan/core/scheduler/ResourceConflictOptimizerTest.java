package com.chronoplan.core.scheduler;

import com.chronoplan.core.engine.CancellationToken;
import com.chronoplan.core.engine.EngineProperties;
import com.chronoplan.core.engine.ScheduleCancelledException;
import com.chronoplan.core.graph.CriticalPathAnalyzer;
import com.chronoplan.core.model.OptimizationResult;
import com.chronoplan.core.model.OptimizationStrategy;
import com.chronoplan.core.model.Priority;
import com.chronoplan.core.model.Project;
import com.chronoplan.core.model.ProjectStatus;
import com.chronoplan.core.model.ResourceConflict;
import com.chronoplan.core.model.ResourcePoolItem;
import com.chronoplan.core.model.ScheduleEdge;
import com.chronoplan.core.model.Task;
import com.chronoplan.core.model.TaskChange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class ResourceConflictOptimizerTest {

    private static final Project PROJECT = new Project("PRJ-01", "Platform", LocalDate.of(2024, 1, 1),
            LocalDate.of(2024, 3, 31), ProjectStatus.ACTIVE, List.of());

    private static final List<ResourcePoolItem> POOL = List.of(new ResourcePoolItem("dev1", "Developer", 1));

    private ResourceConflictOptimizer optimizer;

    @BeforeEach
    void setUp() {
        optimizer = new ResourceConflictOptimizer(new CriticalPathAnalyzer(), new EngineProperties());
    }

    private static Task task(String id, String start, String end, String assignee, Priority priority) {
        return new Task(id, "Task " + id, LocalDate.parse(start), LocalDate.parse(end), assignee, priority);
    }

    /** T1 (P1) overlaps T2 (P0) on dev1 from Jan 3 to Jan 5. */
    private static List<Task> overlappingPair() {
        return List.of(
                task("T1", "2024-01-01", "2024-01-05", "dev1", Priority.P1),
                task("T2", "2024-01-03", "2024-01-07", "dev1", Priority.P0));
    }

    private static LocalDate latestEnd(List<Task> tasks) {
        return tasks.stream().map(Task::endDate).max(Comparator.naturalOrder()).orElseThrow();
    }

    @Nested
    @DisplayName("Smoothing")
    class Smoothing {

        @Test
        @DisplayName("shifts the lower-priority task within its slack and keeps the end date")
        void shiftsLowerPriorityTask() {
            OptimizationResult result = optimizer.optimizeSchedule(
                    PROJECT, overlappingPair(), POOL, OptimizationStrategy.SMOOTHING);

            assertEquals(1, result.changes().size());
            TaskChange change = result.changes().get(0);
            assertEquals("T1", change.taskId());
            assertEquals("Task T1", change.taskName());
            assertEquals(LocalDate.of(2024, 1, 1), change.originalStart());
            assertEquals(LocalDate.of(2024, 1, 3), change.newStart());
            assertEquals(2, change.delayDays());
            assertEquals(ResourceConflictOptimizer.SMOOTHING_REASON, change.reason());

            Task t2 = result.optimizedTasks().get(1);
            assertEquals(LocalDate.of(2024, 1, 3), t2.startDate());

            assertEquals(6, result.metrics().originalDuration());
            assertEquals(6, result.metrics().newDuration());
            assertEquals(2, result.metrics().conflictsResolved());
            assertEquals(1, result.metrics().peakOverloadReduced());
        }

        @Test
        @DisplayName("never moves the overall end date on generated plans")
        void endDateInvariant() {
            Random random = new Random(42);
            var pool = List.of(new ResourcePoolItem("dev1", "Developer", 1), new ResourcePoolItem("qa1", "QA", 1));
            for (int run = 0; run < 25; run++) {
                var tasks = new ArrayList<Task>();
                for (int i = 0; i < 6; i++) {
                    LocalDate start = LocalDate.of(2024, 1, 1).plusDays(random.nextInt(20));
                    tasks.add(new Task("T" + i, "Task " + i, start, start.plusDays(random.nextInt(8)),
                            random.nextBoolean() ? "dev1" : "qa1", Priority.values()[random.nextInt(3)]));
                }

                var result = optimizer.optimizeSchedule(PROJECT, tasks, pool, OptimizationStrategy.SMOOTHING);

                assertEquals(result.metrics().originalDuration(), result.metrics().newDuration(), "run " + run);
                assertFalse(latestEnd(result.optimizedTasks()).isAfter(latestEnd(tasks)), "run " + run);
            }
        }

        @Test
        @DisplayName("a critical task without slack is never moved")
        void criticalTaskStays() {
            var tasks = List.of(
                    task("A", "2024-01-01", "2024-01-10", "dev1", Priority.P2),
                    task("B", "2024-01-01", "2024-01-10", "dev1", Priority.P0));

            var result = optimizer.optimizeSchedule(PROJECT, tasks, POOL, OptimizationStrategy.SMOOTHING);

            assertFalse(result.hasChanges());
            assertEquals(0, result.metrics().conflictsResolved());
            assertEquals(1, result.metrics().peakOverloadReduced());
        }
    }

    @Nested
    @DisplayName("Leveling")
    class Leveling {

        @Test
        @DisplayName("keeps shifting past the original end date")
        void extendsEndDate() {
            var result = optimizer.optimizeSchedule(PROJECT, overlappingPair(), POOL, OptimizationStrategy.LEVELING);

            assertEquals(1, result.changes().size());
            TaskChange change = result.changes().get(0);
            assertEquals("T1", change.taskId());
            assertEquals(LocalDate.of(2024, 1, 6), change.newStart());
            assertEquals(5, change.delayDays());
            assertEquals(ResourceConflictOptimizer.LEVELING_REASON, change.reason());

            assertEquals(LocalDate.of(2024, 1, 10), result.optimizedTasks().get(0).endDate());
            assertEquals(6, result.metrics().originalDuration());
            assertEquals(9, result.metrics().newDuration());
            assertEquals(5, result.metrics().conflictsResolved());
        }

        @Test
        @DisplayName("can report fewer shifts than smoothing when one task absorbs the overlap")
        void fewerShiftsThanSmoothing() {
            var pool = List.of(new ResourcePoolItem("qa1", "QA", 2));
            var tasks = List.of(
                    task("T1", "2024-01-09", "2024-01-13", "qa1", Priority.P2),
                    task("T0", "2024-01-10", "2024-01-12", "qa1", Priority.P0),
                    task("T2", "2024-01-10", "2024-01-15", "qa1", Priority.P1));

            var smoothing = optimizer.optimizeSchedule(PROJECT, tasks, pool, OptimizationStrategy.SMOOTHING);
            var leveling = optimizer.optimizeSchedule(PROJECT, tasks, pool, OptimizationStrategy.LEVELING);

            // smoothing spends T1's 2 days and T0's 3 days of slack; leveling only drags T1
            assertEquals(5, smoothing.metrics().conflictsResolved());
            assertEquals(6, smoothing.metrics().newDuration());
            assertEquals(3, leveling.metrics().conflictsResolved());
            assertEquals(7, leveling.metrics().newDuration());
            assertEquals(List.of("T1"), leveling.changes().stream().map(TaskChange::taskId).toList());
        }

        @Test
        @DisplayName("counts one shift per day moved and never ends earlier than smoothing on generated plans")
        void comparedWithSmoothing() {
            Random random = new Random(7);
            var pool = List.of(new ResourcePoolItem("dev1", "Developer", 1), new ResourcePoolItem("qa1", "QA", 2));
            for (int run = 0; run < 50; run++) {
                var tasks = new ArrayList<Task>();
                int count = 2 + random.nextInt(5);
                for (int i = 0; i < count; i++) {
                    LocalDate start = LocalDate.of(2024, 1, 1).plusDays(random.nextInt(15));
                    tasks.add(new Task("T" + i, "Task " + i, start, start.plusDays(random.nextInt(7)),
                            random.nextBoolean() ? "dev1" : "qa1", Priority.values()[random.nextInt(3)]));
                }

                var smoothing = optimizer.optimizeSchedule(PROJECT, tasks, pool, OptimizationStrategy.SMOOTHING);
                var leveling = optimizer.optimizeSchedule(PROJECT, tasks, pool, OptimizationStrategy.LEVELING);

                for (var result : List.of(smoothing, leveling)) {
                    long shiftedDays = result.changes().stream().mapToLong(TaskChange::delayDays).sum();
                    assertEquals(shiftedDays, result.metrics().conflictsResolved(), "run " + run);
                    int currentRun = run;
                    result.changes().forEach(c -> assertTrue(c.delayDays() > 0, "run " + currentRun));
                }
                assertTrue(leveling.metrics().newDuration() >= smoothing.metrics().newDuration(), "run " + run);
                assertFalse(latestEnd(leveling.optimizedTasks()).isBefore(latestEnd(tasks)), "run " + run);
            }
        }

        @Test
        @DisplayName("missing priorities are moved before prioritised tasks")
        void nullPriorityMovesFirst() {
            var tasks = List.of(
                    task("A", "2024-01-01", "2024-01-02", "dev1", Priority.P2),
                    task("B", "2024-01-01", "2024-01-02", "dev1", null),
                    task("C", "2024-01-01", "2024-01-09", "qa1", Priority.P0));

            var result = optimizer.optimizeSchedule(PROJECT, tasks,
                    List.of(new ResourcePoolItem("dev1", "Developer", 1), new ResourcePoolItem("qa1", "QA", 1)),
                    OptimizationStrategy.LEVELING);

            assertEquals("B", result.changes().get(0).taskId());
        }
    }

    @Nested
    @DisplayName("General behaviour")
    class General {

        @Test
        @DisplayName("empty task list yields an unchanged result")
        void emptyInput() {
            var result = optimizer.optimizeSchedule(PROJECT, List.of(), POOL, OptimizationStrategy.LEVELING);
            assertTrue(result.optimizedTasks().isEmpty());
            assertFalse(result.hasChanges());
            assertEquals(0, result.metrics().conflictsResolved());
        }

        @Test
        @DisplayName("sufficient capacity means nothing moves")
        void enoughCapacity() {
            var result = optimizer.optimizeSchedule(PROJECT, overlappingPair(),
                    List.of(new ResourcePoolItem("dev1", "Developers", 2)), OptimizationStrategy.LEVELING);
            assertFalse(result.hasChanges());
            assertEquals(0, result.metrics().peakOverloadReduced());
        }

        @Test
        @DisplayName("a conflict-free plan yields zero changes on repeated runs")
        void idempotentOnConflictFreePlan() {
            var tasks = List.of(
                    task("T1", "2024-01-01", "2024-01-03", "dev1", Priority.P1),
                    task("T2", "2024-01-04", "2024-01-06", "dev1", Priority.P0));

            for (var strategy : OptimizationStrategy.values()) {
                var first = optimizer.optimizeSchedule(PROJECT, tasks, POOL, strategy);
                var second = optimizer.optimizeSchedule(PROJECT, first.optimizedTasks(), POOL, strategy);
                assertFalse(first.hasChanges());
                assertFalse(second.hasChanges());
                assertEquals(tasks, second.optimizedTasks());
            }
        }

        @Test
        @DisplayName("caller's task list is not modified and output keeps its order")
        void inputUntouched() {
            var tasks = new ArrayList<>(List.of(
                    task("T2", "2024-01-03", "2024-01-07", "dev1", Priority.P0),
                    task("T1", "2024-01-01", "2024-01-05", "dev1", Priority.P1)));
            var snapshot = List.copyOf(tasks);

            var result = optimizer.optimizeSchedule(PROJECT, tasks, POOL, OptimizationStrategy.SMOOTHING);

            assertEquals(snapshot, tasks);
            assertEquals("T2", result.optimizedTasks().get(0).id());
            assertEquals("T1", result.optimizedTasks().get(1).id());
            assertEquals(LocalDate.of(2024, 1, 3), result.optimizedTasks().get(1).startDate());
        }

        @Test
        @DisplayName("tasks assigned outside the pool are ignored")
        void unpooledAssignee() {
            var tasks = List.of(
                    task("T1", "2024-01-01", "2024-01-05", "contractor", Priority.P1),
                    task("T2", "2024-01-01", "2024-01-05", "contractor", Priority.P2));
            var result = optimizer.optimizeSchedule(PROJECT, tasks, POOL, OptimizationStrategy.LEVELING);
            assertFalse(result.hasChanges());
        }

        @Test
        @DisplayName("explicit edges change which task is treated as critical")
        void explicitEdges() {
            var tasks = List.of(
                    task("T1", "2024-01-01", "2024-01-05", "dev1", Priority.P2),
                    task("T2", "2024-01-03", "2024-01-06", "dev1", Priority.P0),
                    task("T3", "2024-01-04", "2024-01-20", "qa1", Priority.P0));
            var pool = List.of(new ResourcePoolItem("dev1", "Developer", 1), new ResourcePoolItem("qa1", "QA", 1));

            var dateAnchored = optimizer.optimizeSchedule(PROJECT, tasks, pool, OptimizationStrategy.LEVELING);
            assertEquals(List.of("T1"), dateAnchored.changes().stream().map(TaskChange::taskId).toList());

            // T1 -> T3 puts T1 on the critical path, so the non-critical T2 moves instead
            var withEdge = optimizer.optimizeSchedule(PROJECT, tasks, pool, OptimizationStrategy.LEVELING,
                    List.of(new ScheduleEdge("T1", "T3")), CancellationToken.NONE);
            assertEquals(List.of("T2"), withEdge.changes().stream().map(TaskChange::taskId).toList());
            assertEquals(3, withEdge.changes().get(0).delayDays());
        }

        @Test
        @DisplayName("a cancelled token aborts the simulation")
        void cancellation() {
            var token = new CancellationToken();
            token.cancel();
            assertThrows(ScheduleCancelledException.class, () -> optimizer.optimizeSchedule(
                    PROJECT, overlappingPair(), POOL, OptimizationStrategy.LEVELING, List.of(), token));
        }
    }

    @Nested
    @DisplayName("Conflict detection")
    class Detection {

        @Test
        @DisplayName("reports each over-allocated day with the competing tasks")
        void detectsOverlap() {
            List<ResourceConflict> conflicts = optimizer.detectConflicts(overlappingPair(), POOL);

            assertEquals(3, conflicts.size());
            assertEquals(LocalDate.of(2024, 1, 3), conflicts.get(0).date());
            assertEquals(LocalDate.of(2024, 1, 5), conflicts.get(2).date());
            ResourceConflict first = conflicts.get(0);
            assertEquals("dev1", first.resourceId());
            assertEquals("Developer", first.resourceName());
            assertEquals(1, first.capacity());
            assertEquals(2, first.allocated());
            assertEquals(1, first.overload());
            assertEquals(List.of("T1", "T2"), first.taskIds());
        }

        @Test
        @DisplayName("no tasks or no pool means no conflicts")
        void emptyInputs() {
            assertTrue(optimizer.detectConflicts(List.of(), POOL).isEmpty());
            assertTrue(optimizer.detectConflicts(overlappingPair(), List.of()).isEmpty());
        }
    }
}
