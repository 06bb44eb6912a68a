package com.chronoplan.dispatch.cli;

import com.chronoplan.core.engine.SchedulingEngine;
import com.chronoplan.core.model.DependencyEdge;
import com.chronoplan.core.model.Portfolio;
import com.chronoplan.core.portfolio.PortfolioReader;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;

/**
 * CLI command: chronoplan dependencies &lt;file&gt;
 * <p>
 * Always re-infers the graph, ignoring any dependencies stored in the file.
 */
@Command(name = "dependencies", mixinStandardHelpOptions = true,
        description = "Infer cross-project dependencies from shared resources and dates")
@Component
public class DependenciesCommand extends PortfolioCommand {

    public DependenciesCommand(PortfolioReader portfolioReader, SchedulingEngine engine) {
        super(portfolioReader, engine);
    }

    @Override
    protected int execute(Portfolio portfolio) {
        List<DependencyEdge> edges = engine.buildDependencyGraph(portfolio.projectsOrEmpty());
        if (edges.isEmpty()) {
            ConsoleOutput.success("No dependencies inferred");
            return 0;
        }
        ConsoleOutput.info(edges.size() + " dependenc" + (edges.size() == 1 ? "y" : "ies") + " inferred:");
        edges.forEach(ConsoleOutput::dependency);
        return 0;
    }
}
