package com.gamewright.core.llm;

import com.gamewright.core.model.ProviderKind;
import org.springframework.ai.chat.model.ChatModel;

/**
 * Builds a Spring AI {@link ChatModel} for one request. Models are never shared between
 * requests, so a per-request credential cannot leak into another call.
 */
public interface ChatModelFactory {

    ChatModel create(ProviderKind provider, String model, String apiKey);
}
