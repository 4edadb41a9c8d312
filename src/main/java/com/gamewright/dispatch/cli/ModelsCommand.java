package com.gamewright.dispatch.cli;

import com.gamewright.core.llm.ModelCatalog;
import com.gamewright.core.model.ProviderKind;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: gamewright models [--provider &lt;name&gt;]
 * <p>
 * Lists the known models for each provider family.
 */
@Command(name = "models", mixinStandardHelpOptions = true, description = "List known models")
@Component
public class ModelsCommand implements Callable<Integer> {

    @Option(names = "--provider", description = "Only list models for this provider")
    private String provider;

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        List<ProviderKind> kinds;
        if (provider == null || provider.isBlank()) {
            // google-files shares the google catalog
            kinds = List.of(ProviderKind.ANTHROPIC_DIRECT, ProviderKind.OPENAI_DIRECT, ProviderKind.GOOGLE_DIRECT);
        } else {
            try {
                kinds = List.of(ProviderKind.fromId(provider));
            } catch (IllegalArgumentException e) {
                ConsoleOutput.error(e.getMessage());
                return 1;
            }
        }

        for (ProviderKind kind : kinds) {
            String defaultModel = ModelCatalog.getDefaultModel(kind);
            ConsoleOutput.info(kind.id() + ":");
            for (ModelCatalog.ModelInfo model : ModelCatalog.modelsFor(kind)) {
                ConsoleOutput.model(model, model.id().equals(defaultModel));
            }
        }
        return 0;
    }
}
