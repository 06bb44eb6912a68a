package com.chronoplan.core.graph;

import com.chronoplan.core.engine.EngineProperties;
import com.chronoplan.core.model.DependencyEdge;
import com.chronoplan.core.model.DependencyStatus;
import com.chronoplan.core.model.DependencyType;
import com.chronoplan.core.model.Project;
import com.chronoplan.core.model.ProjectStatus;
import com.chronoplan.core.model.ResourceRequirement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DependencyGraphBuilderTest {

    private static final Instant NOW = Instant.parse("2024-06-01T09:00:00Z");

    private EngineProperties properties;
    private DependencyGraphBuilder builder;

    @BeforeEach
    void setUp() {
        properties = new EngineProperties();
        builder = new DependencyGraphBuilder(properties, new CriticalPathAnalyzer(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Project project(String id, String start, String end, String... resources) {
        return project(id, start, end, ProjectStatus.ACTIVE, resources);
    }

    private static Project project(String id, String start, String end, ProjectStatus status, String... resources) {
        List<ResourceRequirement> reqs = new ArrayList<>();
        for (String r : resources) {
            reqs.add(new ResourceRequirement(r, 1));
        }
        return new Project(id, "Project " + id, LocalDate.parse(start), LocalDate.parse(end), status, reqs);
    }

    @Nested
    @DisplayName("Temporal classification")
    class Temporal {

        @Test
        @DisplayName("target starting within the window after the source ends is finish-to-start")
        void finishToStart() {
            var edges = builder.buildDependencyGraph(List.of(
                    project("P1", "2024-01-01", "2024-01-31"),
                    project("P2", "2024-02-03", "2024-03-31")));

            assertEquals(1, edges.size());
            DependencyEdge edge = edges.get(0);
            assertEquals("dep-P1-P2", edge.id());
            assertEquals("P1", edge.sourceProjectId());
            assertEquals("Project P2", edge.targetProjectName());
            assertEquals(DependencyType.FINISH_TO_START, edge.type());
            assertEquals("Temporal dependency", edge.description());
            assertEquals(DependencyStatus.ACTIVE, edge.status());
            assertEquals(NOW, edge.createdAt());
        }

        @Test
        @DisplayName("close start dates are start-to-start")
        void startToStart() {
            var edges = builder.buildDependencyGraph(List.of(
                    project("P1", "2024-01-01", "2024-03-31"),
                    project("P2", "2024-01-05", "2024-06-30")));
            assertEquals(DependencyType.START_TO_START, edges.get(0).type());
        }

        @Test
        @DisplayName("close end dates are finish-to-finish")
        void finishToFinish() {
            var edges = builder.buildDependencyGraph(List.of(
                    project("P1", "2024-01-01", "2024-03-31"),
                    project("P2", "2024-02-15", "2024-04-03")));
            assertEquals(DependencyType.FINISH_TO_FINISH, edges.get(0).type());
        }

        @Test
        @DisplayName("a gap of exactly the window size is not a dependency")
        void windowIsExclusive() {
            var edges = builder.buildDependencyGraph(List.of(
                    project("P1", "2024-01-01", "2024-01-10"),
                    project("P2", "2024-01-17", "2024-03-31")));
            assertTrue(edges.isEmpty());
        }

        @Test
        @DisplayName("the window size is configurable")
        void configurableWindow() {
            properties.setProximityWindowDays(8);
            var edges = builder.buildDependencyGraph(List.of(
                    project("P1", "2024-01-01", "2024-01-10"),
                    project("P2", "2024-01-17", "2024-03-31")));
            assertEquals(1, edges.size());
            assertEquals(DependencyType.FINISH_TO_START, edges.get(0).type());
        }
    }

    @Nested
    @DisplayName("Shared resources")
    class SharedResources {

        @Test
        @DisplayName("shared resource without a temporal signal yields exactly one finish-to-start edge")
        void sharedOnly() {
            var edges = builder.buildDependencyGraph(List.of(
                    project("P1", "2024-01-01", "2024-01-31", "dev"),
                    project("P2", "2024-06-01", "2024-08-31", "dev")));

            assertEquals(1, edges.size());
            assertEquals(DependencyType.FINISH_TO_START, edges.get(0).type());
            assertEquals("Shared resources: dev", edges.get(0).description());
        }

        @Test
        @DisplayName("shared resources are listed in the source project's order")
        void sharedOrder() {
            var edges = builder.buildDependencyGraph(List.of(
                    project("P1", "2024-01-01", "2024-01-31", "dev", "qa", "ops"),
                    project("P2", "2024-06-01", "2024-08-31", "ops", "dev")));
            assertEquals("Shared resources: dev, ops", edges.get(0).description());
        }

        @Test
        @DisplayName("shared resources and a temporal signal still give one edge with the temporal type")
        void sharedAndTemporal() {
            var edges = builder.buildDependencyGraph(List.of(
                    project("P1", "2024-01-01", "2024-03-31", "dev"),
                    project("P2", "2024-01-03", "2024-06-30", "dev")));

            assertEquals(1, edges.size());
            assertEquals(DependencyType.START_TO_START, edges.get(0).type());
            assertEquals("Shared resources: dev", edges.get(0).description());
        }
    }

    @Nested
    @DisplayName("Graph construction")
    class Construction {

        @Test
        @DisplayName("only planning and active projects are paired")
        void statusFilter() {
            var edges = builder.buildDependencyGraph(List.of(
                    project("P1", "2024-01-01", "2024-01-31", ProjectStatus.COMPLETED, "dev"),
                    project("P2", "2024-01-02", "2024-01-31", ProjectStatus.ON_HOLD, "dev"),
                    project("P3", "2024-01-03", "2024-01-31", ProjectStatus.PLANNING, "dev")));
            assertTrue(edges.isEmpty());
        }

        @Test
        @DisplayName("fewer than two schedulable projects yields no edges")
        void singleProject() {
            assertTrue(builder.buildDependencyGraph(List.of()).isEmpty());
            assertTrue(builder.buildDependencyGraph(List.of(project("P1", "2024-01-01", "2024-01-31"))).isEmpty());
        }

        @Test
        @DisplayName("edges on the portfolio critical path are flagged")
        void criticalFlag() {
            var edges = builder.buildDependencyGraph(List.of(
                    project("A", "2024-01-01", "2024-01-31", "dev"),
                    project("B", "2024-02-03", "2024-04-30", "design"),
                    project("C", "2024-02-05", "2024-06-30", "dev", "dba")));

            assertEquals(3, edges.size());
            assertEquals("dep-A-B", edges.get(0).id());
            assertTrue(edges.get(0).criticalPath());
            assertEquals("dep-A-C", edges.get(1).id());
            assertEquals("Shared resources: dev", edges.get(1).description());
            assertFalse(edges.get(1).criticalPath());
            assertEquals("dep-B-C", edges.get(2).id());
            assertEquals(DependencyType.START_TO_START, edges.get(2).type());
            assertTrue(edges.get(2).criticalPath());
        }

        @Test
        @DisplayName("parallel pair evaluation produces the same edges in the same order")
        void parallelMatchesSequential() {
            var projects = new ArrayList<Project>();
            LocalDate start = LocalDate.of(2024, 1, 1);
            for (int i = 0; i < 12; i++) {
                LocalDate s = start.plusDays(i * 5L);
                projects.add(project("P" + i, s.toString(), s.plusDays(20).toString(), i % 3 == 0 ? "dev" : "qa"));
            }

            properties.setParallelPairThreshold(1_000);
            var sequential = builder.buildDependencyGraph(projects);
            properties.setParallelPairThreshold(2);
            var parallel = builder.buildDependencyGraph(projects);

            assertFalse(sequential.isEmpty());
            assertEquals(sequential, parallel);
        }

        @Test
        @DisplayName("every edge points from the earlier project in input order")
        void edgeDirection() {
            var projects = List.of(
                    project("Late", "2024-03-01", "2024-03-31", "dev"),
                    project("Early", "2024-01-01", "2024-01-31", "dev"));
            var edges = builder.buildDependencyGraph(projects);
            assertEquals(1, edges.size());
            assertEquals("Late", edges.get(0).sourceProjectId());
        }
    }
}
