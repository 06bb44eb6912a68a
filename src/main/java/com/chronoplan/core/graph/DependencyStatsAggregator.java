package com.chronoplan.core.graph;

import com.chronoplan.core.model.DependencyEdge;
import com.chronoplan.core.model.DependencyStats;
import com.chronoplan.core.model.Project;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Counts over the dependency graph for reporting.
 */
@Service
public class DependencyStatsAggregator {

    public DependencyStats aggregate(List<Project> projects, List<DependencyEdge> edges) {
        // Seed with every project so ties resolve in project order
        var incoming = new LinkedHashMap<String, Integer>();
        var outgoing = new LinkedHashMap<String, Integer>();
        for (var project : projects) {
            incoming.put(project.id(), 0);
            outgoing.put(project.id(), 0);
        }

        int critical = 0;
        for (var edge : edges) {
            outgoing.merge(edge.sourceProjectId(), 1, Integer::sum);
            incoming.merge(edge.targetProjectId(), 1, Integer::sum);
            if (edge.criticalPath()) {
                critical++;
            }
        }

        return new DependencyStats(
                edges.size(),
                critical,
                leader(incoming, projects),
                leader(outgoing, projects));
    }

    private DependencyStats.ProjectCount leader(Map<String, Integer> counts, List<Project> projects) {
        String leaderId = null;
        int max = 0;
        for (var entry : counts.entrySet()) {
            if (entry.getValue() > max) {
                max = entry.getValue();
                leaderId = entry.getKey();
            }
        }
        if (leaderId == null) {
            return null;
        }
        String id = leaderId;
        String name = projects.stream()
                .filter(p -> p.id().equals(id))
                .findFirst()
                .map(Project::name)
                .orElse("");
        return new DependencyStats.ProjectCount(id, name, max);
    }
}
