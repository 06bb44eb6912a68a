package com.chronoplan.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Chronoplan.
 * Routes to subcommands that each load a portfolio JSON file and run one engine operation.
 */
@Command(
        name = "chronoplan",
        mixinStandardHelpOptions = true,
        version = "Chronoplan 0.1.0",
        description = "Portfolio scheduling engine: critical paths, resource smoothing and leveling, delay impact",
        subcommands = {
                CriticalPathCommand.class,
                OptimizeCommand.class,
                ConflictsCommand.class,
                CapacityCommand.class,
                DependenciesCommand.class,
                PropagateCommand.class,
                StatsCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ChronoplanCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
