package com.crosscheck.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Crosscheck.
 */
@Command(
        name = "crosscheck",
        mixinStandardHelpOptions = true,
        version = "Crosscheck 0.1.0",
        description = "Orchestrates agents that validate each other's work",
        subcommands = {
                ServeCommand.class,
                HealthCommand.class,
                StatusCommand.class,
                EscalationsCommand.class,
                ResolveCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class CrosscheckCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // the injected spec keeps the subcommands built by the Spring factory
        spec.commandLine().usage(System.out);
    }
}
