package com.gamewright.core.upload;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gamewright.core.error.GenerationCancelledException;
import com.gamewright.core.error.InputUnreadableException;
import com.gamewright.core.error.TransportException;
import com.gamewright.core.error.UploadFailedException;
import com.gamewright.core.model.FileState;
import com.gamewright.core.model.RemoteFile;
import com.gamewright.core.model.UploadedFileHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * HTTP client for the Gemini Files API and {@code generateContent}.
 *
 * <p>Uploads use the resumable protocol: a {@code start} request returns an upload URL,
 * then a single {@code upload, finalize} request carries the bytes. Authentication is the
 * {@code x-goog-api-key} header so the key never appears in a URL.
 */
public class GoogleFilesApiClient implements FileBackedProviderClient {

    private static final Logger log = LoggerFactory.getLogger(GoogleFilesApiClient.class);

    private static final String API_VERSION = "v1beta";
    private static final String API_KEY_HEADER = "x-goog-api-key";

    private final String baseUrl;
    private final String apiKey;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public GoogleFilesApiClient(String baseUrl, String apiKey, HttpClient httpClient) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public RemoteFile upload(Path file, String mimeType, String displayName) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new InputUnreadableException("Could not read staged file " + file, e);
        }

        ObjectNode metadata = objectMapper.createObjectNode();
        metadata.putObject("file").put("display_name", displayName);

        var start = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/upload/" + API_VERSION + "/files"))
                .header(API_KEY_HEADER, apiKey)
                .header("X-Goog-Upload-Protocol", "resumable")
                .header("X-Goog-Upload-Command", "start")
                .header("X-Goog-Upload-Header-Content-Length", String.valueOf(bytes.length))
                .header("X-Goog-Upload-Header-Content-Type", mimeType)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(metadata.toString()))
                .build();
        var startResponse = send(start, "start upload of " + displayName);
        String uploadUrl = startResponse.headers().firstValue("x-goog-upload-url")
                .orElseThrow(() -> new UploadFailedException(
                        "Upload failed for " + displayName + ": no upload URL returned"));

        var finalize = HttpRequest.newBuilder()
                .uri(URI.create(uploadUrl))
                .header(API_KEY_HEADER, apiKey)
                .header("X-Goog-Upload-Offset", "0")
                .header("X-Goog-Upload-Command", "upload, finalize")
                .POST(HttpRequest.BodyPublishers.ofByteArray(bytes))
                .build();
        JsonNode body = readJson(send(finalize, "upload " + displayName), "upload " + displayName);

        JsonNode fileNode = body.has("file") ? body.get("file") : body;
        RemoteFile remote = toRemoteFile(fileNode);
        log.debug("Upload of {} accepted as {} (state={})", displayName, remote.name(), remote.state());
        return remote;
    }

    @Override
    public RemoteFile fetch(String remoteName) {
        var request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/" + API_VERSION + "/" + encodeName(remoteName)))
                .header(API_KEY_HEADER, apiKey)
                .header("Accept", "application/json")
                .GET()
                .build();
        return toRemoteFile(readJson(send(request, "GET " + remoteName), "GET " + remoteName));
    }

    @Override
    public void delete(String remoteName) {
        var request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/" + API_VERSION + "/" + encodeName(remoteName)))
                .header(API_KEY_HEADER, apiKey)
                .DELETE()
                .build();
        send(request, "DELETE " + remoteName);
    }

    @Override
    public String generate(String model, String prompt, String systemInstruction, List<UploadedFileHandle> files) {
        ObjectNode body = objectMapper.createObjectNode();
        ObjectNode content = body.putArray("contents").addObject();
        content.put("role", "user");
        ArrayNode parts = content.putArray("parts");
        parts.addObject().put("text", prompt);
        for (UploadedFileHandle file : files) {
            ObjectNode fileData = parts.addObject().putObject("fileData");
            fileData.put("fileUri", file.uri());
            fileData.put("mimeType", file.contentType() != null ? file.contentType() : "application/octet-stream");
        }
        // only user/model roles are allowed in contents; the system instruction is separate
        if (systemInstruction != null && !systemInstruction.isBlank()) {
            body.putObject("systemInstruction").putArray("parts").addObject().put("text", systemInstruction);
        }

        var request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/" + API_VERSION + "/models/" + encode(model) + ":generateContent"))
                .header(API_KEY_HEADER, apiKey)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body.toString()))
                .build();
        JsonNode response = readJson(send(request, "generateContent"), "generateContent");
        return extractText(response);
    }

    String extractText(JsonNode response) {
        JsonNode candidates = response.path("candidates");
        if (!candidates.isArray() || candidates.isEmpty()) {
            String blockReason = response.path("promptFeedback").path("blockReason").asText("");
            if (!blockReason.isEmpty()) {
                log.warn("Gemini returned no candidates (blockReason={})", blockReason);
            }
            return "";
        }
        var sb = new StringBuilder();
        for (JsonNode part : candidates.get(0).path("content").path("parts")) {
            if (part.has("text")) {
                sb.append(part.get("text").asText());
            }
        }
        return sb.toString();
    }

    private RemoteFile toRemoteFile(JsonNode node) {
        String name = node.path("name").asText(null);
        String uri = node.path("uri").asText(null);
        String mimeType = node.path("mimeType").asText(null);
        FileState state = FileState.fromRemote(node.path("state").asText(""));
        return new RemoteFile(name, uri, mimeType, state);
    }

    private HttpResponse<String> send(HttpRequest request, String description) {
        try {
            var response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 400) {
                throw new TransportException("Gemini API %s failed (HTTP %d): %s"
                        .formatted(description, response.statusCode(), response.body()));
            }
            return response;
        } catch (IOException e) {
            throw new TransportException("Gemini API request failed: " + description, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationCancelledException("Interrupted during Gemini API " + description, e);
        }
    }

    private JsonNode readJson(HttpResponse<String> response, String description) {
        try {
            String body = response.body();
            return body == null || body.isBlank() ? objectMapper.createObjectNode() : objectMapper.readTree(body);
        } catch (IOException e) {
            throw new TransportException("Unreadable response from Gemini API " + description, e);
        }
    }

    // remote names look like "files/abc-123"; keep the slash, encode the rest
    private static String encodeName(String remoteName) {
        int slash = remoteName.indexOf('/');
        if (slash < 0) {
            return encode(remoteName);
        }
        return remoteName.substring(0, slash + 1) + encode(remoteName.substring(slash + 1));
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
