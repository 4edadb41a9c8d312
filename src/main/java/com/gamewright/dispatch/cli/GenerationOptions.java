package com.gamewright.dispatch.cli;

import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * Options shared by the generation commands.
 */
public class GenerationOptions {

    @Option(names = {"--output", "-o"}, required = true, description = "Directory the artifact is written to")
    Path output;

    @Option(names = {"--project", "-p"}, required = true, description = "Project name, used in the artifact file name")
    String project;

    @Option(names = "--provider",
            description = "anthropic, openai, google or google-files (default: gamewright.llm.provider)")
    String provider;

    @Option(names = {"--model", "-m"}, description = "Model name (default: configured or provider default)")
    String model;
}
