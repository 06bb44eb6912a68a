package com.chronoplan.dispatch.cli;

import com.chronoplan.core.engine.SchedulingEngine;
import com.chronoplan.core.model.ImpactEntry;
import com.chronoplan.core.model.Portfolio;
import com.chronoplan.core.portfolio.PortfolioReader;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: chronoplan propagate &lt;file&gt; --project &lt;id&gt; --delay &lt;days&gt;
 */
@Command(name = "propagate", mixinStandardHelpOptions = true,
        description = "Show which projects slip when one project is delayed")
@Component
public class PropagateCommand extends PortfolioCommand {

    @Option(names = {"--project", "-p"}, required = true, description = "Delayed project")
    private String projectId;

    @Option(names = {"--delay", "-d"}, required = true, description = "Delay in days")
    private long delayDays;

    public PropagateCommand(PortfolioReader portfolioReader, SchedulingEngine engine) {
        super(portfolioReader, engine);
    }

    @Override
    protected int execute(Portfolio portfolio) {
        if (requireProject(portfolio, projectId).isEmpty()) {
            return 1;
        }
        List<ImpactEntry> impact = engine.propagateDelay(
                projectId, delayDays, portfolio.projectsOrEmpty(), dependenciesOf(portfolio));
        if (impact.isEmpty()) {
            ConsoleOutput.success("No downstream projects affected");
            return 0;
        }
        ConsoleOutput.info("Delaying " + projectId + " by " + delayDays + " day(s) affects "
                + impact.size() + " project(s):");
        impact.forEach(ConsoleOutput::impact);
        return 0;
    }
}
