package com.chronoplan.dispatch.cli;

import com.chronoplan.ChronoplanApplication;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs the portfolio command line once the Spring context is up, building the
 * subcommands through the Spring-aware picocli factory so they receive the engine.
 * The command's return value becomes the process exit code.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final ChronoplanCommand chronoplanCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(ChronoplanCommand chronoplanCommand, IFactory factory) {
        this.chronoplanCommand = chronoplanCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        if (ChronoplanApplication.isServeMode(args)) {
            // REST mode: requests arrive over HTTP, there is no command to run
            return;
        }
        exitCode = new CommandLine(chronoplanCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
