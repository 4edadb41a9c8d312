package com.gamewright.core.llm;

import com.gamewright.core.error.TransportException;
import com.gamewright.core.model.ProviderKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.client.ChatClient.ChatClientRequestSpec;
import org.springframework.ai.chat.client.ChatClient.StreamResponseSpec;
import reactor.core.publisher.Flux;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Mocks the {@link ChatClient} streaming chain so no real provider is called.
 */
class ChatClientTextGenerationClientTest {

    private ChatClient mockChatClient;
    private ChatClientRequestSpec mockRequestSpec;
    private StreamResponseSpec mockStream;
    private ChatClientTextGenerationClient client;

    @BeforeEach
    void setUp() {
        mockChatClient = mock(ChatClient.class);
        mockRequestSpec = mock(ChatClientRequestSpec.class);
        mockStream = mock(StreamResponseSpec.class);

        when(mockChatClient.prompt()).thenReturn(mockRequestSpec);
        when(mockRequestSpec.system(anyString())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.user(anyString())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.stream()).thenReturn(mockStream);

        client = new ChatClientTextGenerationClient(ProviderKind.ANTHROPIC_DIRECT, mockChatClient);
    }

    @Test
    @DisplayName("joins streamed chunks in arrival order")
    void joinsChunks() {
        when(mockStream.content()).thenReturn(Flux.just("# Atom", " Quest", "\n\nA game."));

        String text = client.sendText("Write a spec", "You are a designer");

        assertEquals("# Atom Quest\n\nA game.", text);
        verify(mockRequestSpec).system("You are a designer");
        verify(mockRequestSpec).user("Write a spec");
    }

    @Test
    @DisplayName("skips the system message when none is given")
    void noSystemInstruction() {
        when(mockStream.content()).thenReturn(Flux.just("ok"));

        client.sendText("Prompt", null);

        verify(mockRequestSpec, never()).system(anyString());
    }

    @Test
    @DisplayName("an empty stream yields empty text")
    void emptyStream() {
        when(mockStream.content()).thenReturn(Flux.empty());
        assertEquals("", client.sendText("Prompt", null));
    }

    @Test
    @DisplayName("stream errors become TransportException")
    void streamError() {
        when(mockStream.content()).thenReturn(Flux.error(new IllegalStateException("401 Unauthorized")));

        var e = assertThrows(TransportException.class, () -> client.sendText("Prompt", null));
        assertTrue(e.getMessage().contains("anthropic"));
        assertTrue(e.getMessage().contains("401 Unauthorized"));
    }
}
