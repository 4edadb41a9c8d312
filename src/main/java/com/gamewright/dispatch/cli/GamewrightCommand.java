package com.gamewright.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Gamewright.
 * Routes to subcommands: spec, implement, models.
 */
@Command(
        name = "gamewright",
        mixinStandardHelpOptions = true,
        version = "Gamewright 0.1.0",
        description = "Turns course material into educational game specifications and implementations",
        subcommands = {
                SpecCommand.class,
                ImplementCommand.class,
                ModelsCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class GamewrightCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
