package com.chronoplan.dispatch.cli;

import com.chronoplan.core.engine.SchedulingEngine;
import com.chronoplan.core.model.CapacityConflict;
import com.chronoplan.core.model.Portfolio;
import com.chronoplan.core.model.Project;
import com.chronoplan.core.model.ResourceAvailability;
import com.chronoplan.core.portfolio.PortfolioReader;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.time.YearMonth;
import java.util.List;
import java.util.Optional;

/**
 * CLI command: chronoplan capacity &lt;file&gt; [--candidate &lt;id&gt;] [--resource &lt;id&gt; --from --to]
 */
@Command(name = "capacity", mixinStandardHelpOptions = true,
        description = "Check project resource requirements against pool capacity, month by month")
@Component
public class CapacityCommand extends PortfolioCommand {

    @Option(names = {"--candidate", "-c"},
            description = "Only report conflicts this project takes part in, checked against the rest")
    private String candidateId;

    @Option(names = {"--resource", "-r"}, description = "Also print monthly availability of this resource")
    private String resourceId;

    @Option(names = "--from", description = "First month of the availability report (yyyy-MM)")
    private YearMonth from;

    @Option(names = "--to", description = "Last month of the availability report (yyyy-MM)")
    private YearMonth to;

    public CapacityCommand(PortfolioReader portfolioReader, SchedulingEngine engine) {
        super(portfolioReader, engine);
    }

    @Override
    protected int execute(Portfolio portfolio) {
        List<CapacityConflict> conflicts;
        if (candidateId != null) {
            Optional<Project> candidate = requireProject(portfolio, candidateId);
            if (candidate.isEmpty()) {
                return 1;
            }
            List<Project> others = portfolio.projectsOrEmpty().stream()
                    .filter(p -> !p.id().equals(candidateId))
                    .toList();
            conflicts = engine.checkProjectConflicts(candidate.get(), others, portfolio.resourcePoolOrEmpty());
        } else {
            conflicts = engine.detectCapacityConflicts(portfolio.projectsOrEmpty(), portfolio.resourcePoolOrEmpty());
        }

        if (conflicts.isEmpty()) {
            ConsoleOutput.success("No capacity conflicts");
        } else {
            ConsoleOutput.info(conflicts.size() + " capacity conflict(s):");
            conflicts.forEach(ConsoleOutput::capacityConflict);
        }

        if (resourceId != null) {
            if (from == null || to == null) {
                ConsoleOutput.error("--resource needs --from and --to");
                return 1;
            }
            List<ResourceAvailability> availability = engine.resourceAvailability(
                    resourceId, from, to, portfolio.projectsOrEmpty(), portfolio.resourcePoolOrEmpty());
            if (availability.isEmpty()) {
                ConsoleOutput.warn("No availability for " + resourceId + " between " + from + " and " + to);
            } else {
                ConsoleOutput.info("Availability of " + resourceId + ":");
                availability.forEach(ConsoleOutput::availability);
            }
        }
        return 0;
    }
}
