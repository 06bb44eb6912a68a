package com.chronoplan.core.graph;

import com.chronoplan.core.model.CriticalPathResult;
import com.chronoplan.core.model.DependencyEdge;
import com.chronoplan.core.model.Project;
import com.chronoplan.core.model.ScheduleEdge;
import com.chronoplan.core.model.ScheduleNode;
import com.chronoplan.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Longest-path analysis over a weighted precedence graph.
 * <p>
 * Runs Kahn's topological sort, relaxing each successor's earliest finish as its
 * predecessors are popped, then walks the order backwards to derive latest finish
 * and slack. Nodes on or behind a cycle never reach in-degree zero; they are left
 * out of every map and listed in {@link CriticalPathResult#unresolvedNodeIds()}.
 */
@Service
public class CriticalPathAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(CriticalPathAnalyzer.class);

    /**
     * Compute the critical path and per-node slack.
     *
     * @param nodes weighted nodes; duplicate ids keep the first occurrence
     * @param edges precedence edges; edges naming unknown nodes are ignored
     * @return the analysis; {@link CriticalPathResult#empty()} for an empty node set
     */
    public CriticalPathResult computeCriticalPath(List<ScheduleNode> nodes, List<ScheduleEdge> edges) {
        if (nodes.isEmpty()) {
            return CriticalPathResult.empty();
        }

        var byId = new LinkedHashMap<String, ScheduleNode>();
        for (var node : nodes) {
            byId.putIfAbsent(node.id(), node);
        }

        var successors = new HashMap<String, List<String>>();
        var inDegree = new LinkedHashMap<String, Integer>();
        for (var id : byId.keySet()) {
            successors.put(id, new ArrayList<>());
            inDegree.put(id, 0);
        }
        for (var edge : edges) {
            if (!byId.containsKey(edge.from()) || !byId.containsKey(edge.to())) {
                log.debug("Ignoring edge {} -> {}: unknown node", edge.from(), edge.to());
                continue;
            }
            successors.get(edge.from()).add(edge.to());
            inDegree.merge(edge.to(), 1, Integer::sum);
        }

        // Earliest finish starts at release + duration and only grows through relaxation
        var accumulated = new HashMap<String, Long>();
        for (var node : byId.values()) {
            accumulated.put(node.id(), node.release() + node.duration());
        }
        var predecessors = new HashMap<String, String>();

        var queue = new ArrayDeque<String>();
        inDegree.forEach((id, degree) -> {
            if (degree == 0) {
                queue.add(id);
            }
        });

        var order = new ArrayList<String>();
        while (!queue.isEmpty()) {
            String current = queue.poll();
            order.add(current);
            long currentFinish = accumulated.get(current);

            for (String next : successors.get(current)) {
                long candidate = currentFinish + byId.get(next).duration();
                if (candidate > accumulated.get(next)) {
                    accumulated.put(next, candidate);
                    predecessors.put(next, current);
                }
                if (inDegree.merge(next, -1, Integer::sum) == 0) {
                    queue.add(next);
                }
            }
        }

        var unresolved = new ArrayList<String>();
        if (order.size() < byId.size()) {
            Set<String> resolved = new HashSet<>(order);
            for (var id : byId.keySet()) {
                if (!resolved.contains(id)) {
                    unresolved.add(id);
                }
            }
            log.warn("Cycle detected: {} node(s) excluded from the critical path analysis: {}",
                    unresolved.size(), unresolved);
        }

        if (order.isEmpty()) {
            return new CriticalPathResult(List.of(), Map.of(), Map.of(), Map.of(), List.copyOf(unresolved));
        }

        String terminal = order.get(0);
        for (String id : order) {
            if (accumulated.get(id) > accumulated.get(terminal)) {
                terminal = id;
            }
        }
        long projectFinish = accumulated.get(terminal);

        var path = new ArrayList<String>();
        for (String cursor = terminal; cursor != null; cursor = predecessors.get(cursor)) {
            path.add(cursor);
        }
        Collections.reverse(path);

        var resolvedSet = new HashSet<>(order);
        var latestFinish = new HashMap<String, Long>();
        var slack = new LinkedHashMap<String, Long>();
        for (int i = order.size() - 1; i >= 0; i--) {
            String id = order.get(i);
            long finish = projectFinish;
            for (String next : successors.get(id)) {
                if (resolvedSet.contains(next)) {
                    finish = Math.min(finish, latestFinish.get(next) - byId.get(next).duration());
                }
            }
            latestFinish.put(id, finish);
        }

        var orderedAccumulated = new LinkedHashMap<String, Long>();
        var orderedPredecessors = new LinkedHashMap<String, String>();
        for (String id : order) {
            orderedAccumulated.put(id, accumulated.get(id));
            slack.put(id, latestFinish.get(id) - accumulated.get(id));
            if (predecessors.containsKey(id)) {
                orderedPredecessors.put(id, predecessors.get(id));
            }
        }

        log.debug("Critical path over {} node(s): {} (length {})", order.size(), path, projectFinish);
        return new CriticalPathResult(
                List.copyOf(path),
                Collections.unmodifiableMap(orderedAccumulated),
                Collections.unmodifiableMap(orderedPredecessors),
                Collections.unmodifiableMap(slack),
                List.copyOf(unresolved));
    }

    /**
     * Critical path over a task set. Each task is anchored at its start-date offset from the
     * earliest start, so with no declared dependencies a task's slack is the distance between
     * its end and the latest end in the set.
     *
     * @param tasks         tasks to analyse
     * @param explicitEdges additional precedence edges beyond each task's own dependency list
     */
    public CriticalPathResult computeTaskCriticalPath(List<Task> tasks, List<ScheduleEdge> explicitEdges) {
        if (tasks.isEmpty()) {
            return CriticalPathResult.empty();
        }
        LocalDate origin = tasks.stream()
                .map(Task::startDate)
                .min(Comparator.naturalOrder())
                .orElseThrow();

        var nodes = tasks.stream()
                .map(t -> new ScheduleNode(t.id(), t.duration(), ChronoUnit.DAYS.between(origin, t.startDate())))
                .toList();
        var edges = new ArrayList<>(explicitEdges);
        edges.addAll(TaskDependencyGraph.edgesOf(tasks));
        return computeCriticalPath(nodes, edges);
    }

    /**
     * Critical path across projects, weighted by each project's duration.
     */
    public CriticalPathResult computeProjectCriticalPath(List<Project> projects, List<DependencyEdge> dependencies) {
        var nodes = projects.stream()
                .map(p -> new ScheduleNode(p.id(), p.duration()))
                .toList();
        var edges = dependencies.stream()
                .map(DependencyEdge::toScheduleEdge)
                .toList();
        return computeCriticalPath(nodes, edges);
    }
}
