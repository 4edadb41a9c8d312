package com.gamewright.core.llm;

import com.gamewright.core.model.ProviderConfig;
import com.gamewright.core.model.ProviderKind;
import org.springframework.stereotype.Component;

/**
 * Builds the {@link ProviderConfig} for a request from {@link LlmProperties}, letting the
 * command line override the provider and model.
 */
@Component
public class ProviderSelector {

    private final LlmProperties properties;

    public ProviderSelector(LlmProperties properties) {
        this.properties = properties;
    }

    /**
     * @param providerOverride provider name from the command line, or {@code null}
     * @param modelOverride    model name from the command line, or {@code null}
     * @throws IllegalArgumentException for an unknown provider name
     */
    public ProviderConfig select(String providerOverride, String modelOverride) {
        ProviderKind kind = ProviderKind.fromId(isBlank(providerOverride) ? properties.getProvider() : providerOverride);
        String model = !isBlank(modelOverride) ? modelOverride : properties.getModel();
        if (isBlank(model)) {
            model = ModelCatalog.getDefaultModel(kind);
        }
        return new ProviderConfig(kind, model, credentialFor(kind));
    }

    String credentialFor(ProviderKind kind) {
        return switch (kind) {
            case ANTHROPIC_DIRECT -> properties.getAnthropicApiKey();
            case OPENAI_DIRECT -> properties.getOpenaiApiKey();
            case GOOGLE_DIRECT, GOOGLE_FILES -> properties.getGoogleApiKey();
        };
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
