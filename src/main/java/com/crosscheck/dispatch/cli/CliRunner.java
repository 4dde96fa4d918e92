package com.crosscheck.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final CrosscheckCommand crosscheckCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(CrosscheckCommand crosscheckCommand, IFactory factory) {
        this.crosscheckCommand = crosscheckCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) throws Exception {
        // In serve mode the embedded web server keeps the JVM alive; picocli would return at once.
        for (String arg : args) {
            if ("serve".equals(arg)) {
                return;
            }
        }
        exitCode = new CommandLine(crosscheckCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
