package com.gamewright.core.llm;

import com.gamewright.core.error.GenerationException;
import com.gamewright.core.error.TransportException;
import com.gamewright.core.model.ProviderKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;

import java.util.List;

/**
 * {@link TextGenerationClient} backed by Spring AI's {@link ChatClient}.
 * <p>
 * The response is streamed and the chunks are concatenated in arrival order.
 */
public class ChatClientTextGenerationClient implements TextGenerationClient {

    private static final Logger log = LoggerFactory.getLogger(ChatClientTextGenerationClient.class);

    private final ProviderKind provider;
    private final ChatClient chatClient;

    public ChatClientTextGenerationClient(ProviderKind provider, ChatClient chatClient) {
        this.provider = provider;
        this.chatClient = chatClient;
    }

    @Override
    public String sendText(String prompt, String systemInstruction) {
        log.info("Sending prompt to {} ({} chars)", provider.id(), prompt.length());
        long start = System.currentTimeMillis();

        List<String> chunks;
        try {
            var request = chatClient.prompt();
            if (systemInstruction != null && !systemInstruction.isBlank()) {
                request = request.system(systemInstruction);
            }
            chunks = request.user(prompt)
                    .stream()
                    .content()
                    .collectList()
                    .block();
        } catch (GenerationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TransportException("Failed to communicate with " + provider.id() + ": " + e.getMessage(), e);
        }

        String text = chunks == null ? "" : String.join("", chunks);
        long elapsed = System.currentTimeMillis() - start;
        log.info("{} responded with {} chunks, {} chars ({}s)", provider.id(),
                chunks == null ? 0 : chunks.size(), text.length(), String.format("%.1f", elapsed / 1000.0));
        return text;
    }
}
