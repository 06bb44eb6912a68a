package com.chronoplan.core.graph;

import com.chronoplan.core.model.ScheduleEdge;
import com.chronoplan.core.model.Task;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Traversals over the predecessor lists declared on tasks. All of them tolerate cycles.
 */
public final class TaskDependencyGraph {

    private TaskDependencyGraph() {
        // utility class
    }

    /** One edge per declared dependency, predecessor first. */
    public static List<ScheduleEdge> edgesOf(List<Task> tasks) {
        var edges = new ArrayList<ScheduleEdge>();
        for (var task : tasks) {
            if (!task.hasDependencies()) continue;
            for (var dep : task.dependencies()) {
                edges.add(new ScheduleEdge(dep, task.id()));
            }
        }
        return edges;
    }

    /**
     * Checks whether declaring "{@code toTaskId} depends on {@code fromTaskId}" would close a cycle.
     * The task list is not modified.
     */
    public static boolean wouldCreateCycle(List<Task> tasks, String fromTaskId, String toTaskId) {
        if (fromTaskId.equals(toTaskId)) {
            return true;
        }
        // A cycle appears iff toTaskId is already a (transitive) predecessor of fromTaskId
        return allPredecessors(fromTaskId, tasks).contains(toTaskId);
    }

    /**
     * Moves each task so it starts no earlier than the day after its latest predecessor ends,
     * preserving durations. Tasks are only ever moved later. Declared dependencies on unknown
     * ids are ignored, and tasks on a cycle are pushed only by predecessors outside it.
     *
     * @return a new list in the input order; the input is not modified
     */
    public static List<Task> alignToDependencies(List<Task> tasks) {
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < tasks.size(); i++) {
            index.putIfAbsent(tasks.get(i).id(), i);
        }
        Map<String, List<String>> downstream = new HashMap<>();
        Map<String, Integer> inDegree = new HashMap<>();
        for (var edge : edgesOf(tasks)) {
            if (!index.containsKey(edge.from()) || !index.containsKey(edge.to())) continue;
            downstream.computeIfAbsent(edge.from(), k -> new ArrayList<>()).add(edge.to());
            inDegree.merge(edge.to(), 1, Integer::sum);
        }

        Task[] aligned = tasks.toArray(new Task[0]);
        var ready = new ArrayDeque<String>();
        for (var task : tasks) {
            if (inDegree.getOrDefault(task.id(), 0) == 0) {
                ready.add(task.id());
            }
        }
        while (!ready.isEmpty()) {
            Task predecessor = aligned[index.get(ready.poll())];
            LocalDate earliest = predecessor.endDate().plusDays(1);
            for (String next : downstream.getOrDefault(predecessor.id(), List.of())) {
                int i = index.get(next);
                if (aligned[i].startDate().isBefore(earliest)) {
                    aligned[i] = aligned[i].shiftedBy(ChronoUnit.DAYS.between(aligned[i].startDate(), earliest));
                }
                if (inDegree.merge(next, -1, Integer::sum) == 0) {
                    ready.add(next);
                }
            }
        }
        return List.of(aligned);
    }

    /** Transitive predecessors of a task, nearest first. */
    public static Set<String> allPredecessors(String taskId, List<Task> tasks) {
        Map<String, List<String>> upstream = new HashMap<>();
        for (var task : tasks) {
            upstream.put(task.id(), task.hasDependencies() ? task.dependencies() : List.of());
        }
        return closure(taskId, upstream);
    }

    /** Transitive successors of a task, nearest first. */
    public static Set<String> allSuccessors(String taskId, List<Task> tasks) {
        Map<String, List<String>> downstream = new HashMap<>();
        for (var edge : edgesOf(tasks)) {
            downstream.computeIfAbsent(edge.from(), k -> new ArrayList<>()).add(edge.to());
        }
        return closure(taskId, downstream);
    }

    private static Set<String> closure(String start, Map<String, List<String>> adjacency) {
        var found = new LinkedHashSet<String>();
        var queue = new ArrayDeque<String>();
        queue.add(start);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String next : adjacency.getOrDefault(current, List.of())) {
                if (!next.equals(start) && found.add(next)) {
                    queue.add(next);
                }
            }
        }
        return found;
    }
}
