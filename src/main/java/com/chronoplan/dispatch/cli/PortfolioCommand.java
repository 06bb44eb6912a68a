package com.chronoplan.dispatch.cli;

import com.chronoplan.core.engine.SchedulingEngine;
import com.chronoplan.core.model.DependencyEdge;
import com.chronoplan.core.model.Portfolio;
import com.chronoplan.core.model.Project;
import com.chronoplan.core.portfolio.InvalidPortfolioException;
import com.chronoplan.core.portfolio.PortfolioReadException;
import com.chronoplan.core.portfolio.PortfolioReader;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Shared plumbing for subcommands that operate on a portfolio file: loading, validation
 * errors and exit codes. Subclasses implement {@link #execute(Portfolio)}.
 */
abstract class PortfolioCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Portfolio JSON file")
    protected Path portfolioFile;

    protected final PortfolioReader portfolioReader;
    protected final SchedulingEngine engine;

    protected PortfolioCommand(PortfolioReader portfolioReader, SchedulingEngine engine) {
        this.portfolioReader = portfolioReader;
        this.engine = engine;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        Portfolio portfolio;
        try {
            portfolio = portfolioReader.read(portfolioFile);
        } catch (InvalidPortfolioException e) {
            ConsoleOutput.error("Portfolio rejected:");
            e.getViolations().forEach(v -> System.out.println("    - " + v));
            return 2;
        } catch (PortfolioReadException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }
        return execute(portfolio);
    }

    protected abstract int execute(Portfolio portfolio);

    /** Declared dependencies when the file carries them, otherwise freshly inferred ones. */
    protected List<DependencyEdge> dependenciesOf(Portfolio portfolio) {
        return portfolio.declaredDependencies()
                .orElseGet(() -> engine.buildDependencyGraph(portfolio.projectsOrEmpty()));
    }

    protected Optional<Project> requireProject(Portfolio portfolio, String projectId) {
        Optional<Project> project = portfolio.findProject(projectId);
        if (project.isEmpty()) {
            ConsoleOutput.error("Project not found: " + projectId);
        }
        return project;
    }
}
