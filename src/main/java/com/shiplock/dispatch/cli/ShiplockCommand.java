package com.shiplock.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Shiplock.
 * Routes to subcommands: converge, status, health.
 */
@Command(
        name = "shiplock",
        mixinStandardHelpOptions = true,
        version = "Shiplock 0.1.0",
        description = "Builds and deploys an exact revision and waits until it is live",
        subcommands = {
                ConvergeCommand.class,
                StatusCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ShiplockCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
