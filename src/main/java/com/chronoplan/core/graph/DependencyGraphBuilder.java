package com.chronoplan.core.graph;

import com.chronoplan.core.engine.EngineProperties;
import com.chronoplan.core.model.CriticalPathResult;
import com.chronoplan.core.model.DependencyEdge;
import com.chronoplan.core.model.DependencyStatus;
import com.chronoplan.core.model.DependencyType;
import com.chronoplan.core.model.Project;
import com.chronoplan.core.model.ResourceRequirement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * Infers project-to-project dependencies from shared resources and date proximity.
 * <p>
 * Every unordered pair of planning/active projects is evaluated once, so at most one
 * edge is emitted per pair, always directed from the earlier project in the input list.
 * Large portfolios evaluate pairs on a parallel stream; the stream is ordered, so the
 * output order matches the sequential (i, j) order either way.
 */
@Service
public class DependencyGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraphBuilder.class);

    static final String TEMPORAL_DESCRIPTION = "Temporal dependency";

    private final EngineProperties properties;
    private final CriticalPathAnalyzer criticalPathAnalyzer;
    private final Clock clock;

    public DependencyGraphBuilder(EngineProperties properties,
                                  CriticalPathAnalyzer criticalPathAnalyzer,
                                  Clock clock) {
        this.properties = properties;
        this.criticalPathAnalyzer = criticalPathAnalyzer;
        this.clock = clock;
    }

    /**
     * Build the inferred dependency graph.
     *
     * @param projects full project list, any status
     * @return inferred edges with the critical-path flag set
     */
    public List<DependencyEdge> buildDependencyGraph(List<Project> projects) {
        List<Project> candidates = projects.stream()
                .filter(p -> p.status() != null && p.status().isSchedulable())
                .toList();
        int n = candidates.size();
        if (n < 2) {
            log.debug("buildDependencyGraph: {} schedulable project(s), nothing to pair", n);
            return List.of();
        }

        Instant createdAt = clock.instant();
        boolean parallel = n >= properties.getParallelPairThreshold();
        log.debug("buildDependencyGraph: evaluating {} pairs across {} projects (parallel={})",
                (long) n * (n - 1) / 2, n, parallel);

        IntStream firstIndices = IntStream.range(0, n);
        if (parallel) {
            firstIndices = firstIndices.parallel();
        }
        List<DependencyEdge> edges = firstIndices
                .boxed()
                .flatMap(i -> IntStream.range(i + 1, n)
                        .mapToObj(j -> evaluatePair(candidates.get(i), candidates.get(j), createdAt))
                        .flatMap(Optional::stream))
                .toList();

        List<DependencyEdge> flagged = flagCriticalEdges(candidates, edges);
        log.info("Inferred {} dependency edge(s) across {} schedulable project(s)", flagged.size(), n);
        return flagged;
    }

    Optional<DependencyEdge> evaluatePair(Project source, Project target, Instant createdAt) {
        List<String> shared = sharedResources(source, target);
        Optional<DependencyType> temporal = classifyTemporal(source, target);

        if (shared.isEmpty() && temporal.isEmpty()) {
            return Optional.empty();
        }

        String description = shared.isEmpty()
                ? TEMPORAL_DESCRIPTION
                : "Shared resources: " + String.join(", ", shared);
        DependencyType type = temporal.orElse(DependencyType.FINISH_TO_START);

        log.debug("  {} -> {}: {} ({})", source.id(), target.id(), type, description);
        return Optional.of(new DependencyEdge(
                "dep-" + source.id() + "-" + target.id(),
                source.id(), source.name(),
                target.id(), target.name(),
                type, description, false, DependencyStatus.ACTIVE, createdAt));
    }

    /**
     * Resource ids required by both projects, in the source project's requirement order.
     */
    static List<String> sharedResources(Project source, Project target) {
        Set<String> targetIds = new LinkedHashSet<>();
        for (ResourceRequirement r : target.requirementsOrEmpty()) {
            targetIds.add(r.resourceId());
        }
        var shared = new LinkedHashSet<String>();
        for (ResourceRequirement r : source.requirementsOrEmpty()) {
            if (targetIds.contains(r.resourceId())) {
                shared.add(r.resourceId());
            }
        }
        return new ArrayList<>(shared);
    }

    /**
     * Classifies the date relationship between two projects using the proximity window.
     * Checked in order: target starting shortly after source ends, close starts, close ends.
     */
    Optional<DependencyType> classifyTemporal(Project source, Project target) {
        long window = properties.getProximityWindowDays();
        LocalDate start1 = source.startDate();
        LocalDate end1 = source.endDate();
        LocalDate start2 = target.startDate();
        LocalDate end2 = target.endDate();

        if (start2.isAfter(end1) && ChronoUnit.DAYS.between(end1, start2) < window) {
            return Optional.of(DependencyType.FINISH_TO_START);
        }
        if (Math.abs(ChronoUnit.DAYS.between(start1, start2)) < window) {
            return Optional.of(DependencyType.START_TO_START);
        }
        if (Math.abs(ChronoUnit.DAYS.between(end1, end2)) < window) {
            return Optional.of(DependencyType.FINISH_TO_FINISH);
        }
        return Optional.empty();
    }

    private List<DependencyEdge> flagCriticalEdges(List<Project> candidates, List<DependencyEdge> edges) {
        if (edges.isEmpty()) {
            return edges;
        }
        CriticalPathResult result = criticalPathAnalyzer.computeProjectCriticalPath(candidates, edges);
        List<String> path = result.criticalPath();
        if (path.size() < 2) {
            return edges;
        }

        var criticalPairs = new LinkedHashSet<String>();
        for (int i = 0; i + 1 < path.size(); i++) {
            criticalPairs.add(path.get(i) + "->" + path.get(i + 1));
        }
        return edges.stream()
                .map(e -> criticalPairs.contains(e.sourceProjectId() + "->" + e.targetProjectId())
                        ? e.withCriticalPath(true)
                        : e)
                .toList();
    }
}
