package com.chronoplan.core.graph;

import com.chronoplan.core.engine.CancellationToken;
import com.chronoplan.core.model.DependencyEdge;
import com.chronoplan.core.model.ImpactEntry;
import com.chronoplan.core.model.Project;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Cascades a delay at one project through the dependency graph.
 * <p>
 * Breadth-first from the delayed project; every downstream project receives the same
 * absolute delay (it does not compound per hop). A visited set bounds the traversal,
 * so cyclic graphs terminate with each project reported at most once.
 */
@Service
public class DelayPropagator {

    private static final Logger log = LoggerFactory.getLogger(DelayPropagator.class);

    private record Pending(String projectId, long delayDays) {}

    public List<ImpactEntry> propagateDelay(String projectId, long delayDays,
                                            List<Project> projects, List<DependencyEdge> edges) {
        return propagateDelay(projectId, delayDays, projects, edges, CancellationToken.NONE);
    }

    /**
     * Compute the downstream impact of delaying {@code projectId}.
     *
     * @param projectId   the delayed project
     * @param delayDays   delay applied at the start project
     * @param projects    full project list (for names and end dates)
     * @param edges       dependency edges; only direction is used
     * @param cancellation checked once per dequeued project
     * @return impacted projects in breadth-first order, excluding the start project
     */
    public List<ImpactEntry> propagateDelay(String projectId, long delayDays,
                                            List<Project> projects, List<DependencyEdge> edges,
                                            CancellationToken cancellation) {
        Map<String, Project> byId = projects.stream()
                .collect(Collectors.toMap(Project::id, Function.identity(), (a, b) -> a));

        var dependents = new HashMap<String, List<String>>();
        for (var edge : edges) {
            dependents.computeIfAbsent(edge.sourceProjectId(), k -> new ArrayList<>())
                    .add(edge.targetProjectId());
        }

        var impacted = new ArrayList<ImpactEntry>();
        var visited = new HashSet<String>();
        var queue = new ArrayDeque<Pending>();
        queue.add(new Pending(projectId, delayDays));

        while (!queue.isEmpty()) {
            cancellation.throwIfCancelled("Delay propagation");
            Pending current = queue.poll();

            if (!visited.add(current.projectId())) {
                continue;
            }

            Project project = byId.get(current.projectId());
            if (project == null) {
                log.debug("Skipping unknown project {} during propagation", current.projectId());
                continue;
            }

            if (!current.projectId().equals(projectId)) {
                impacted.add(new ImpactEntry(
                        project.id(),
                        project.name(),
                        project.endDate(),
                        project.endDate().plusDays(current.delayDays()),
                        current.delayDays()));
            }

            for (String next : dependents.getOrDefault(current.projectId(), List.of())) {
                queue.add(new Pending(next, current.delayDays()));
            }
        }

        log.info("Delay of {} day(s) at {} impacts {} downstream project(s)",
                delayDays, projectId, impacted.size());
        return impacted;
    }
}
