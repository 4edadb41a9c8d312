package com.gamewright.dispatch.cli;

import com.gamewright.core.llm.ModelCatalog;
import com.gamewright.core.model.GenerationResult;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Gamewright CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) GAMEWRIGHT v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [GAMEWRIGHT]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    /**
     * Prints the outcome of a generation and returns the matching process exit code.
     */
    public static int result(GenerationResult result) {
        if (result.success()) {
            success("Artifact written: " + result.outputPath());
            return 0;
        }
        error("Generation failed [" + result.errorKind() + "]: " + result.error());
        return 1;
    }

    public static void model(ModelCatalog.ModelInfo model, boolean isDefault) {
        String uploads = model.acceptsFileUploads() ? " @|fg(magenta) [files]|@" : "";
        String marker = isDefault ? " @|fg(green) (default)|@" : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                "  @|bold %-28s|@ %-18s %-12s%s%s", model.id(), model.name(),
                model.contextDisplay(), uploads, marker)));
        System.out.println("      " + model.description());
    }
}
