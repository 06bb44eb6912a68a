package com.chronoplan.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SchedulingMetricsTest {

    private SimpleMeterRegistry registry;
    private SchedulingMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new SchedulingMetrics(registry);
    }

    @Test
    @DisplayName("recordOperation creates a timer per operation")
    void recordOperation() {
        metrics.recordOperation("optimize", 120);
        metrics.recordOperation("optimize", 80);
        metrics.recordOperation("propagate", 5);

        var optimize = registry.find("chronoplan.operation.duration").tag("operation", "optimize").timer();
        var propagate = registry.find("chronoplan.operation.duration").tag("operation", "propagate").timer();
        assertNotNull(optimize);
        assertNotNull(propagate);
        assertEquals(2, optimize.count());
        assertEquals(1, propagate.count());
    }

    @Test
    @DisplayName("recordConflictsResolved accumulates per strategy")
    void recordConflictsResolved() {
        metrics.recordConflictsResolved("smoothing", 2);
        metrics.recordConflictsResolved("smoothing", 3);
        metrics.recordConflictsResolved("leveling", 7);

        assertEquals(5.0, registry.find("chronoplan.optimizer.conflicts_resolved")
                .tag("strategy", "smoothing").counter().count());
        assertEquals(7.0, registry.find("chronoplan.optimizer.conflicts_resolved")
                .tag("strategy", "leveling").counter().count());
    }

    @Test
    @DisplayName("dependency and propagation summaries record each call")
    void summaries() {
        metrics.recordDependenciesInferred(4);
        metrics.recordDependenciesInferred(0);
        metrics.recordProjectsImpacted(3);

        var inferred = registry.find("chronoplan.dependencies.inferred").summary();
        assertNotNull(inferred);
        assertEquals(2, inferred.count());
        assertEquals(4.0, inferred.totalAmount());
        assertEquals(3.0, registry.find("chronoplan.propagation.impacted").summary().totalAmount());
    }

    @Test
    @DisplayName("recordCycleDetected counts analyses and excluded nodes")
    void recordCycleDetected() {
        metrics.recordCycleDetected(3);
        metrics.recordCycleDetected(2);

        assertEquals(2.0, registry.find("chronoplan.critical_path.cycles").counter().count());
        assertEquals(5.0, registry.find("chronoplan.critical_path.excluded_nodes").summary().totalAmount());
    }
}
