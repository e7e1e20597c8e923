package com.liteunit.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for LiteUnit.
 * Routes to subcommands: run, demo.
 */
@Command(
        name = "liteunit",
        mixinStandardHelpOptions = true,
        version = "LiteUnit 0.1.0",
        description = "Runs unit-test suites sequentially or on a worker pool",
        subcommands = {
                RunCommand.class,
                DemoCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class LiteUnitCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
