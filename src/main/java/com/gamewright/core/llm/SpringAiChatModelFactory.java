package com.gamewright.core.llm;

import com.gamewright.core.model.ProviderKind;
import org.springframework.ai.anthropic.AnthropicChatModel;
import org.springframework.ai.anthropic.AnthropicChatOptions;
import org.springframework.ai.anthropic.api.AnthropicApi;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.stereotype.Component;

/**
 * Creates Anthropic and OpenAI chat models through Spring AI. Gemini's direct variant goes
 * through its OpenAI-compatible endpoint, so it reuses the OpenAI module.
 */
@Component
public class SpringAiChatModelFactory implements ChatModelFactory {

    private static final String GEMINI_COMPLETIONS_PATH = "/chat/completions";

    private final LlmProperties properties;

    public SpringAiChatModelFactory(LlmProperties properties) {
        this.properties = properties;
    }

    @Override
    public ChatModel create(ProviderKind provider, String model, String apiKey) {
        return switch (provider) {
            case ANTHROPIC_DIRECT -> anthropic(model, apiKey);
            case OPENAI_DIRECT -> openAi(OpenAiApi.builder().apiKey(apiKey).build(), model);
            case GOOGLE_DIRECT -> openAi(OpenAiApi.builder()
                    .baseUrl(properties.getGoogleOpenaiBaseUrl())
                    .completionsPath(GEMINI_COMPLETIONS_PATH)
                    .apiKey(apiKey)
                    .build(), model);
            case GOOGLE_FILES -> throw new IllegalArgumentException(
                    "google-files has no chat model; it is driven through the upload lifecycle");
        };
    }

    private ChatModel anthropic(String model, String apiKey) {
        var api = AnthropicApi.builder().apiKey(apiKey).build();
        var options = AnthropicChatOptions.builder()
                .model(model)
                .maxTokens(properties.getMaxTokens())
                .build();
        return AnthropicChatModel.builder()
                .anthropicApi(api)
                .defaultOptions(options)
                .build();
    }

    private ChatModel openAi(OpenAiApi api, String model) {
        var options = OpenAiChatOptions.builder()
                .model(model)
                .build();
        return OpenAiChatModel.builder()
                .openAiApi(api)
                .defaultOptions(options)
                .build();
    }
}
