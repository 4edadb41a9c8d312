package com.gamewright.dispatch.cli;

import com.gamewright.core.engine.GenerationOrchestrator;
import com.gamewright.core.llm.ProviderSelector;
import com.gamewright.core.model.ProviderConfig;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: gamewright spec --source &lt;file&gt;... --output &lt;dir&gt; --project &lt;name&gt;
 * <p>
 * Generates a Markdown game specification from source documents, optionally steered by
 * guideline documents.
 */
@Command(name = "spec", mixinStandardHelpOptions = true, description = "Generate a game specification")
@Component
public class SpecCommand implements Callable<Integer> {

    @Option(names = {"--source", "-s"}, required = true, arity = "1..*",
            description = "Source documents providing the game's content")
    private List<Path> sources;

    @Option(names = {"--guideline", "-g"}, arity = "1..*",
            description = "Prompting/guideline documents")
    private List<Path> guidelines = new ArrayList<>();

    @Mixin
    private GenerationOptions options;

    private final GenerationOrchestrator orchestrator;
    private final ProviderSelector providerSelector;

    public SpecCommand(GenerationOrchestrator orchestrator, ProviderSelector providerSelector) {
        this.orchestrator = orchestrator;
        this.providerSelector = providerSelector;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        ProviderConfig config;
        try {
            config = providerSelector.select(options.provider, options.model);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        ConsoleOutput.info(String.format("Generating specification for '%s' with %s (%s): %d sources, %d guidelines",
                options.project, config.provider().id(), config.model(), sources.size(), guidelines.size()));
        return ConsoleOutput.result(orchestrator.generateSpecification(
                sources, guidelines, options.output, options.project, config));
    }
}
