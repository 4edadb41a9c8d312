package com.gamewright.dispatch.cli;

import com.gamewright.core.engine.GenerationOrchestrator;
import com.gamewright.core.llm.ProviderSelector;
import com.gamewright.core.model.ProviderConfig;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: gamewright implement --specification &lt;file&gt;... --output &lt;dir&gt; --project &lt;name&gt;
 */
@Command(name = "implement", mixinStandardHelpOptions = true,
        description = "Generate a SOLUZION game implementation from specifications")
@Component
public class ImplementCommand implements Callable<Integer> {

    @Option(names = {"--specification", "-s"}, required = true, arity = "1..*",
            description = "Game specification documents")
    private List<Path> specifications;

    @Mixin
    private GenerationOptions options;

    private final GenerationOrchestrator orchestrator;
    private final ProviderSelector providerSelector;

    public ImplementCommand(GenerationOrchestrator orchestrator, ProviderSelector providerSelector) {
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

        ConsoleOutput.info(String.format("Implementing '%s' with %s (%s) from %d specification(s)",
                options.project, config.provider().id(), config.model(), specifications.size()));
        return ConsoleOutput.result(orchestrator.implementArtifact(
                specifications, options.output, options.project, config));
    }
}
