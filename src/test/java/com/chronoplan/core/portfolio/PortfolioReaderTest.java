package com.chronoplan.core.portfolio;

import com.chronoplan.core.model.Portfolio;
import com.chronoplan.core.model.Priority;
import com.chronoplan.core.model.ProjectStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PortfolioReaderTest {

    private PortfolioReader reader;

    @BeforeEach
    void setUp() {
        reader = new PortfolioReader(PortfolioReader.defaultObjectMapper(), new PortfolioValidator());
    }

    private InputStream resource(String name) {
        return getClass().getResourceAsStream("/portfolio/" + name);
    }

    @Test
    @DisplayName("reads projects, tasks and the resource pool")
    void readsSample() {
        Portfolio portfolio = reader.read(resource("sample-portfolio.json"), "sample");

        assertEquals(4, portfolio.projectsOrEmpty().size());
        assertEquals(5, portfolio.resourcePoolOrEmpty().size());
        assertTrue(portfolio.declaredDependencies().isEmpty());

        var platform = portfolio.findProject("PRJ-A").orElseThrow();
        assertEquals(ProjectStatus.ACTIVE, platform.status());
        assertEquals(LocalDate.of(2024, 1, 31), platform.endDate());
        assertEquals(0, new BigDecimal("120000").compareTo(platform.budget()));
        assertEquals(3, platform.tasksOrEmpty().size());

        var regression = platform.tasksOrEmpty().get(2);
        assertEquals(Priority.P2, regression.priority());
        assertEquals(List.of("T2"), regression.dependencies());
        assertFalse(platform.tasksOrEmpty().get(0).hasDependencies());

        assertEquals(ProjectStatus.COMPLETED, portfolio.findProject("PRJ-D").orElseThrow().status());
    }

    @Test
    @DisplayName("invalid domain values are rejected with every violation listed")
    void rejectsInvalid() {
        var ex = assertThrows(InvalidPortfolioException.class,
                () -> reader.read(resource("invalid-portfolio.json"), "invalid"));

        assertEquals(3, ex.getViolations().size());
        assertTrue(ex.getViolations().contains("project PRJ-X ends before it starts"));
        assertTrue(ex.getViolations().contains("task T1 ends before it starts"));
        assertTrue(ex.getViolations().contains("resource dev1 has non-positive capacity 0"));
    }

    @Test
    @DisplayName("malformed JSON is reported as a read failure")
    void malformedJson() {
        var in = new ByteArrayInputStream("{ \"projects\": [".getBytes(StandardCharsets.UTF_8));
        var ex = assertThrows(PortfolioReadException.class, () -> reader.read(in, "broken"));
        assertTrue(ex.getMessage().startsWith("Cannot parse portfolio broken"));
    }

    @Test
    @DisplayName("reads from a file path and reports missing files")
    void readsPath(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("portfolio.json");
        Files.writeString(file, "{\"projects\": [], \"resourcePool\": []}");

        assertTrue(reader.read(file).projectsOrEmpty().isEmpty());

        var ex = assertThrows(PortfolioReadException.class, () -> reader.read(dir.resolve("missing.json")));
        assertTrue(ex.getMessage().startsWith("Cannot read portfolio file"));
    }
}
