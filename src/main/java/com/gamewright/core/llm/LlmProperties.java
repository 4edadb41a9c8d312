package com.gamewright.core.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "gamewright.llm")
public class LlmProperties {

    private String provider = "google-files";
    private String model = "";
    private String anthropicApiKey = "";
    private String openaiApiKey = "";
    private String googleApiKey = "";
    private int maxTokens = 8192;
    private String googleOpenaiBaseUrl = "https://generativelanguage.googleapis.com/v1beta/openai";

    /**
     * When true, a provider that answers with no text fails the request with
     * {@code EMPTY_RESPONSE}. Off by default: an empty answer is written as an empty artifact.
     */
    private boolean failOnEmptyResponse = false;

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public String getAnthropicApiKey() {
        return anthropicApiKey;
    }

    public void setAnthropicApiKey(String anthropicApiKey) {
        this.anthropicApiKey = anthropicApiKey;
    }

    public String getOpenaiApiKey() {
        return openaiApiKey;
    }

    public void setOpenaiApiKey(String openaiApiKey) {
        this.openaiApiKey = openaiApiKey;
    }

    public String getGoogleApiKey() {
        return googleApiKey;
    }

    public void setGoogleApiKey(String googleApiKey) {
        this.googleApiKey = googleApiKey;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public void setMaxTokens(int maxTokens) {
        this.maxTokens = maxTokens;
    }

    public String getGoogleOpenaiBaseUrl() {
        return googleOpenaiBaseUrl;
    }

    public void setGoogleOpenaiBaseUrl(String googleOpenaiBaseUrl) {
        this.googleOpenaiBaseUrl = googleOpenaiBaseUrl;
    }

    public boolean isFailOnEmptyResponse() {
        return failOnEmptyResponse;
    }

    public void setFailOnEmptyResponse(boolean failOnEmptyResponse) {
        this.failOnEmptyResponse = failOnEmptyResponse;
    }
}
