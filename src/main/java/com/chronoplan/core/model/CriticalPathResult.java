package com.chronoplan.core.model;

import java.util.List;
import java.util.Map;

/**
 * Output of a longest-path analysis.
 *
 * @param criticalPath      node ids from the first to the terminal node of the longest path
 * @param accumulated       earliest finish distance per resolved node
 * @param predecessors      predecessor achieving the longest distance; absent for path roots
 * @param slack             days each resolved node can slip without moving the terminal node
 * @param unresolvedNodeIds nodes excluded from the topological order because of a cycle
 */
public record CriticalPathResult(
    List<String> criticalPath,
    Map<String, Long> accumulated,
    Map<String, String> predecessors,
    Map<String, Long> slack,
    List<String> unresolvedNodeIds
) {

    public static CriticalPathResult empty() {
        return new CriticalPathResult(List.of(), Map.of(), Map.of(), Map.of(), List.of());
    }

    public boolean isCritical(String nodeId) {
        return criticalPath.contains(nodeId);
    }

    public long slackOf(String nodeId) {
        return slack.getOrDefault(nodeId, 0L);
    }

    /** Accumulated duration of the terminal node, or 0 when there is no path. */
    public long totalDuration() {
        if (criticalPath.isEmpty()) {
            return 0L;
        }
        return accumulated.getOrDefault(criticalPath.get(criticalPath.size() - 1), 0L);
    }

    public boolean hasCycles() {
        return !unresolvedNodeIds.isEmpty();
    }
}
