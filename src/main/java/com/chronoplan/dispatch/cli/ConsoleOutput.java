package com.chronoplan.dispatch.cli;

import com.chronoplan.core.model.CapacityConflict;
import com.chronoplan.core.model.CriticalPathResult;
import com.chronoplan.core.model.DependencyEdge;
import com.chronoplan.core.model.DependencyStats;
import com.chronoplan.core.model.ImpactEntry;
import com.chronoplan.core.model.OptimizationMetrics;
import com.chronoplan.core.model.ResourceAvailability;
import com.chronoplan.core.model.ResourceConflict;
import com.chronoplan.core.model.TaskChange;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Chronoplan CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) CHRONOPLAN v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [CHRONOPLAN]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void criticalPath(CriticalPathResult result) {
        if (result.criticalPath().isEmpty()) {
            warn("No critical path (nothing to analyse)");
        } else {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|bold Path|@ " + String.join(" -> ", result.criticalPath()) +
                    " (" + result.totalDuration() + " days)"));
        }
        result.slack().forEach((id, slack) -> {
            String marker = result.isCritical(id) ? "@|fg(red) *|@" : " ";
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  " + marker + " " + id + "  finish " + result.accumulated().get(id) + ", slack " + slack));
        });
        if (result.hasCycles()) {
            warn("Excluded (cyclic): " + String.join(", ", result.unresolvedNodeIds()));
        }
    }

    public static void taskChange(TaskChange change) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(yellow) ~|@ " + change.taskId() + " " + change.taskName() + ": " +
                change.originalStart() + " -> " + change.newStart() +
                " (+" + change.delayDays() + "d) " + change.reason()));
    }

    public static void conflict(ResourceConflict conflict) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(red) " + conflict.date() + "|@ " + conflict.resourceId() +
                " " + conflict.allocated() + "/" + conflict.capacity() +
                " [" + String.join(", ", conflict.taskIds()) + "]"));
    }

    public static void capacityConflict(CapacityConflict conflict) {
        String projects = String.join(", ", conflict.conflictingProjects().stream()
                .map(a -> a.projectId() + " x" + a.allocation())
                .toList());
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(red) " + conflict.period() + "|@ " + conflict.resourceId() +
                " " + conflict.allocated() + "/" + conflict.capacity() + " [" + projects + "]"));
    }

    public static void availability(ResourceAvailability entry) {
        String color = entry.available() < 0 ? "red" : "green";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + entry.month() + "  @|fg(" + color + ") " + entry.available() + "|@ of " + entry.capacity() +
                " available"));
    }

    public static void dependency(DependencyEdge edge) {
        String critical = edge.criticalPath() ? " @|fg(red),bold CRITICAL|@" : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + edge.sourceProjectId() + " @|fg(blue) -> |@" + edge.targetProjectId() +
                "  " + edge.type() + "  " + edge.description() + critical));
    }

    public static void impact(ImpactEntry entry) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(red) " + entry.projectId() + "|@ " + entry.projectName() + ": " +
                entry.originalEndDate() + " -> " + entry.newEndDate() + " (+" + entry.delayDays() + "d)"));
    }

    public static void metrics(OptimizationMetrics m) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Optimization Metrics|@"));
        System.out.println("  Duration: " + m.originalDuration() + " -> " + m.newDuration() + " days");
        System.out.println("  Conflicts resolved: " + m.conflictsResolved());
        System.out.println("  Peak overload: " + m.peakOverloadReduced());
    }

    public static void stats(DependencyStats stats) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Dependency Statistics|@"));
        System.out.println("  Dependencies: " + stats.totalDependencies() +
                " (" + stats.criticalDependencies() + " critical)");
        System.out.println("  Most dependent: " + describe(stats.mostDependent()));
        System.out.println("  Most blocking:  " + describe(stats.mostBlocking()));
    }

    private static String describe(DependencyStats.ProjectCount count) {
        if (count == null) return "-";
        return count.id() + " " + count.name() + " (" + count.count() + ")";
    }
}
