package com.evolver.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Evolver.
 * Routes to subcommands: run, history.
 */
@Command(
        name = "evolver",
        mixinStandardHelpOptions = true,
        version = "Evolver 0.1.0",
        description = "Autonomous codebase evolution: plan, validate in a sandbox, promote, commit",
        subcommands = {
                RunCommand.class,
                HistoryCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class EvolverCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
