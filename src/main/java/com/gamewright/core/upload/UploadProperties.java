package com.gamewright.core.upload;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "gamewright.upload")
public class UploadProperties {

    private String anchorMarker = ".env";
    private int maxAnchorDepth = 5;
    private String stagingFolder = "uploads-to-GenAI";
    private long pollIntervalMs = 1500;
    private long timeoutMs = 120_000;
    private String apiBaseUrl = "https://generativelanguage.googleapis.com";
    private int connectTimeoutSeconds = 10;

    /** Keys looked up in the marker file, in order. The second is accepted for compatibility. */
    private List<String> credentialKeys = new ArrayList<>(List.of("GEMINI_API_KEY", "GOOGLE_API_KEY"));

    public String getAnchorMarker() { return anchorMarker; }
    public void setAnchorMarker(String anchorMarker) { this.anchorMarker = anchorMarker; }
    public int getMaxAnchorDepth() { return maxAnchorDepth; }
    public void setMaxAnchorDepth(int maxAnchorDepth) { this.maxAnchorDepth = maxAnchorDepth; }
    public String getStagingFolder() { return stagingFolder; }
    public void setStagingFolder(String stagingFolder) { this.stagingFolder = stagingFolder; }
    public long getPollIntervalMs() { return pollIntervalMs; }
    public void setPollIntervalMs(long pollIntervalMs) { this.pollIntervalMs = pollIntervalMs; }
    public long getTimeoutMs() { return timeoutMs; }
    public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }
    public String getApiBaseUrl() { return apiBaseUrl; }
    public void setApiBaseUrl(String apiBaseUrl) { this.apiBaseUrl = apiBaseUrl; }
    public int getConnectTimeoutSeconds() { return connectTimeoutSeconds; }
    public void setConnectTimeoutSeconds(int connectTimeoutSeconds) { this.connectTimeoutSeconds = connectTimeoutSeconds; }
    public List<String> getCredentialKeys() { return credentialKeys; }
    public void setCredentialKeys(List<String> credentialKeys) { this.credentialKeys = credentialKeys; }
}
