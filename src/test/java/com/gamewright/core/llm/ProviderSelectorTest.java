package com.gamewright.core.llm;

import com.gamewright.core.model.ProviderKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProviderSelectorTest {

    private LlmProperties properties;
    private ProviderSelector selector;

    @BeforeEach
    void setUp() {
        properties = new LlmProperties();
        properties.setAnthropicApiKey("anthropic-key");
        properties.setOpenaiApiKey("openai-key");
        properties.setGoogleApiKey("google-key");
        selector = new ProviderSelector(properties);
    }

    @Test
    @DisplayName("uses the configured provider and its catalog default model")
    void defaults() {
        var config = selector.select(null, null);
        assertEquals(ProviderKind.GOOGLE_FILES, config.provider());
        assertEquals("gemini-2.5-flash", config.model());
        assertEquals("google-key", config.credential());
    }

    @Test
    @DisplayName("command-line provider and model override configuration")
    void overrides() {
        properties.setModel("gemini-2.5-pro");
        var config = selector.select("anthropic", "claude-opus-4-20250514");
        assertEquals(ProviderKind.ANTHROPIC_DIRECT, config.provider());
        assertEquals("claude-opus-4-20250514", config.model());
        assertEquals("anthropic-key", config.credential());
    }

    @Test
    @DisplayName("picks the credential for the selected provider")
    void credentials() {
        assertEquals("openai-key", selector.select("openai", null).credential());
        assertEquals("google-key", selector.select("google", null).credential());
    }

    @Test
    @DisplayName("unknown provider names are rejected")
    void unknownProvider() {
        assertThrows(IllegalArgumentException.class, () -> selector.select("cohere", null));
    }
}
