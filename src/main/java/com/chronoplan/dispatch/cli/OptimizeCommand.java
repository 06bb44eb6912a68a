package com.chronoplan.dispatch.cli;

import com.chronoplan.core.engine.SchedulingEngine;
import com.chronoplan.core.model.OptimizationResult;
import com.chronoplan.core.model.OptimizationStrategy;
import com.chronoplan.core.model.Portfolio;
import com.chronoplan.core.model.Project;
import com.chronoplan.core.portfolio.PortfolioReader;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.Optional;

/**
 * CLI command: chronoplan optimize &lt;file&gt; --project &lt;id&gt; [--strategy smoothing|leveling]
 */
@Command(name = "optimize", mixinStandardHelpOptions = true,
        description = "Resolve resource over-allocation in a project's tasks")
@Component
public class OptimizeCommand extends PortfolioCommand {

    @Option(names = {"--project", "-p"}, required = true, description = "Project whose tasks are optimized")
    private String projectId;

    @Option(names = {"--strategy", "-s"},
            description = "smoothing or leveling (default: engine configuration)")
    private String strategy;

    public OptimizeCommand(PortfolioReader portfolioReader, SchedulingEngine engine) {
        super(portfolioReader, engine);
    }

    @Override
    protected int execute(Portfolio portfolio) {
        OptimizationStrategy selected = null;
        if (strategy != null) {
            try {
                selected = OptimizationStrategy.fromString(strategy);
            } catch (IllegalArgumentException e) {
                ConsoleOutput.error("Invalid strategy: " + strategy + ". Valid strategies: smoothing, leveling");
                return 1;
            }
        }

        Optional<Project> project = requireProject(portfolio, projectId);
        if (project.isEmpty()) {
            return 1;
        }

        OptimizationResult result = engine.optimizeSchedule(
                project.get(), project.get().tasksOrEmpty(), portfolio.resourcePoolOrEmpty(), selected);

        if (!result.hasChanges()) {
            ConsoleOutput.success("No tasks moved");
        } else {
            ConsoleOutput.info(result.changes().size() + " task(s) moved:");
            result.changes().forEach(ConsoleOutput::taskChange);
        }
        ConsoleOutput.metrics(result.metrics());
        return 0;
    }
}
