package com.chronoplan.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for the scheduling engine.
 */
@Service
public class SchedulingMetrics {

    private final MeterRegistry registry;

    public SchedulingMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordOperation(String operation, long ms) {
        Timer.builder("chronoplan.operation.duration")
                .tag("operation", operation)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordConflictsResolved(String strategy, int count) {
        Counter.builder("chronoplan.optimizer.conflicts_resolved")
                .description("One-day shifts applied to resolve resource over-allocation")
                .tag("strategy", strategy)
                .register(registry)
                .increment(count);
    }

    public void recordDependenciesInferred(int count) {
        DistributionSummary.builder("chronoplan.dependencies.inferred")
                .description("Edges inferred per dependency graph build")
                .register(registry)
                .record(count);
    }

    public void recordProjectsImpacted(int count) {
        DistributionSummary.builder("chronoplan.propagation.impacted")
                .description("Downstream projects reached per delay propagation")
                .register(registry)
                .record(count);
    }

    /**
     * Records a critical path analysis that had to drop nodes sitting on a cycle.
     *
     * @param excludedNodes how many nodes were left out of the topological order
     */
    public void recordCycleDetected(int excludedNodes) {
        Counter.builder("chronoplan.critical_path.cycles")
                .description("Critical path analyses that excluded cyclic nodes")
                .register(registry)
                .increment();
        DistributionSummary.builder("chronoplan.critical_path.excluded_nodes")
                .register(registry)
                .record(excludedNodes);
    }
}
