package com.chronoplan.dispatch.cli;

import com.chronoplan.core.engine.SchedulingEngine;
import com.chronoplan.core.model.Portfolio;
import com.chronoplan.core.model.Project;
import com.chronoplan.core.model.ResourceConflict;
import com.chronoplan.core.portfolio.PortfolioReader;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.Optional;

/**
 * CLI command: chronoplan conflicts &lt;file&gt; --project &lt;id&gt;
 */
@Command(name = "conflicts", mixinStandardHelpOptions = true,
        description = "List the days on which a project's tasks over-allocate a resource")
@Component
public class ConflictsCommand extends PortfolioCommand {

    @Option(names = {"--project", "-p"}, required = true, description = "Project whose tasks are inspected")
    private String projectId;

    public ConflictsCommand(PortfolioReader portfolioReader, SchedulingEngine engine) {
        super(portfolioReader, engine);
    }

    @Override
    protected int execute(Portfolio portfolio) {
        Optional<Project> project = requireProject(portfolio, projectId);
        if (project.isEmpty()) {
            return 1;
        }
        List<ResourceConflict> conflicts =
                engine.detectConflicts(project.get().tasksOrEmpty(), portfolio.resourcePoolOrEmpty());
        if (conflicts.isEmpty()) {
            ConsoleOutput.success("No resource conflicts");
            return 0;
        }
        ConsoleOutput.info(conflicts.size() + " conflict day(s):");
        conflicts.forEach(ConsoleOutput::conflict);
        return 0;
    }
}
