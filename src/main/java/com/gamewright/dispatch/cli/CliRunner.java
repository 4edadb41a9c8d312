package com.gamewright.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and hands the command's exit code back to Spring.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final GamewrightCommand gamewrightCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(GamewrightCommand gamewrightCommand, IFactory factory) {
        this.gamewrightCommand = gamewrightCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = new CommandLine(gamewrightCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
