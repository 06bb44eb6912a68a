package com.chronoplan.dispatch.cli;

import com.chronoplan.core.engine.SchedulingEngine;
import com.chronoplan.core.model.DependencyStats;
import com.chronoplan.core.model.Portfolio;
import com.chronoplan.core.portfolio.PortfolioReader;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: chronoplan stats &lt;file&gt;
 */
@Command(name = "stats", mixinStandardHelpOptions = true, description = "Summarize the dependency graph")
@Component
public class StatsCommand extends PortfolioCommand {

    public StatsCommand(PortfolioReader portfolioReader, SchedulingEngine engine) {
        super(portfolioReader, engine);
    }

    @Override
    protected int execute(Portfolio portfolio) {
        DependencyStats stats = engine.aggregateDependencyStats(portfolio.projectsOrEmpty(), dependenciesOf(portfolio));
        ConsoleOutput.stats(stats);
        return 0;
    }
}
