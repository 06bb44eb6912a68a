package com.chronoplan.dispatch.cli;

import com.chronoplan.core.engine.SchedulingEngine;
import com.chronoplan.core.model.CriticalPathResult;
import com.chronoplan.core.model.Portfolio;
import com.chronoplan.core.model.Project;
import com.chronoplan.core.portfolio.PortfolioReader;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.Optional;

/**
 * CLI command: chronoplan critical-path &lt;file&gt; [--project &lt;id&gt;]
 * <p>
 * Without {@code --project}, analyses the portfolio over its dependency edges;
 * with it, analyses that project's tasks.
 */
@Command(name = "critical-path", mixinStandardHelpOptions = true,
        description = "Compute the critical path and slack of a portfolio or of one project's tasks")
@Component
public class CriticalPathCommand extends PortfolioCommand {

    @Option(names = {"--project", "-p"}, description = "Analyse the tasks of this project")
    private String projectId;

    public CriticalPathCommand(PortfolioReader portfolioReader, SchedulingEngine engine) {
        super(portfolioReader, engine);
    }

    @Override
    protected int execute(Portfolio portfolio) {
        CriticalPathResult result;
        if (projectId != null) {
            Optional<Project> project = requireProject(portfolio, projectId);
            if (project.isEmpty()) {
                return 1;
            }
            ConsoleOutput.info("Task critical path for " + project.get().name());
            result = engine.computeTaskCriticalPath(project.get().tasksOrEmpty(), List.of());
        } else {
            ConsoleOutput.info("Portfolio critical path");
            result = engine.computeProjectCriticalPath(portfolio.projectsOrEmpty(), dependenciesOf(portfolio));
        }
        ConsoleOutput.criticalPath(result);
        return 0;
    }
}
