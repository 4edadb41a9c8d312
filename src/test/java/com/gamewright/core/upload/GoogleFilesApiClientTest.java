package com.gamewright.core.upload;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gamewright.core.error.TransportException;
import com.gamewright.core.model.FileState;
import com.gamewright.core.model.RemoteFile;
import com.gamewright.core.model.UploadedFileHandle;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Exercises the Gemini Files client against a local HTTP stub.
 */
class GoogleFilesApiClientTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final List<String> requests = new CopyOnWriteArrayList<>();

    private HttpServer server;
    private String baseUrl;
    private GoogleFilesApiClient client;

    private volatile String uploadedBody;
    private volatile String generateBody;
    private volatile String apiKeySeen;
    private volatile String uploadCommand;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::handle);
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
        client = new GoogleFilesApiClient(baseUrl + "/", "test-key", HttpClient.newHttpClient());
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private void handle(HttpExchange exchange) throws IOException {
        String method = exchange.getRequestMethod();
        String path = exchange.getRequestURI().getPath();
        String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        requests.add(method + " " + path);
        apiKeySeen = exchange.getRequestHeaders().getFirst("x-goog-api-key");

        if (method.equals("POST") && path.equals("/upload/v1beta/files")) {
            uploadCommand = exchange.getRequestHeaders().getFirst("X-Goog-Upload-Command");
            exchange.getResponseHeaders().add("x-goog-upload-url", baseUrl + "/upload-session/1");
            respond(exchange, 200, "{}");
        } else if (method.equals("POST") && path.equals("/upload-session/1")) {
            uploadedBody = body;
            respond(exchange, 200, """
                    {"file": {"name": "files/abc", "uri": "https://files/abc", "mimeType": "text/markdown", "state": "PROCESSING"}}""");
        } else if (method.equals("GET") && path.equals("/v1beta/files/abc")) {
            respond(exchange, 200, """
                    {"name": "files/abc", "uri": "https://files/abc", "mimeType": "text/markdown", "state": "ACTIVE"}""");
        } else if (method.equals("DELETE") && path.equals("/v1beta/files/abc")) {
            respond(exchange, 200, "{}");
        } else if (method.equals("POST") && path.equals("/v1beta/models/gemini-2.5-flash:generateContent")) {
            generateBody = body;
            respond(exchange, 200, """
                    {"candidates": [{"content": {"parts": [{"text": "# Atom "}, {"text": "Quest"}]}}]}""");
        } else {
            respond(exchange, 404, "{\"error\": {\"message\": \"not found\"}}");
        }
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        exchange.getResponseBody().write(bytes);
        exchange.close();
    }

    @Test
    @DisplayName("upload runs the resumable start/finalize exchange")
    void upload(@TempDir Path dir) throws IOException {
        Path file = Files.writeString(dir.resolve("notes.md"), "Atoms have protons.");

        RemoteFile remote = client.upload(file, "text/markdown", "notes.md");

        assertEquals("files/abc", remote.name());
        assertEquals("https://files/abc", remote.uri());
        assertEquals(FileState.PENDING, remote.state());
        assertEquals("Atoms have protons.", uploadedBody);
        assertEquals(List.of("POST /upload/v1beta/files", "POST /upload-session/1"), requests);
        assertEquals("test-key", apiKeySeen);
        assertEquals("start", uploadCommand);
    }

    @Test
    @DisplayName("fetch maps the remote state")
    void fetch() {
        RemoteFile remote = client.fetch("files/abc");
        assertEquals(FileState.ACTIVE, remote.state());
        assertEquals("text/markdown", remote.mimeType());
    }

    @Test
    @DisplayName("delete issues a DELETE on the file name")
    void delete() {
        client.delete("files/abc");
        assertEquals(List.of("DELETE /v1beta/files/abc"), requests);
    }

    @Test
    @DisplayName("HTTP errors become TransportException")
    void httpError() {
        var e = assertThrows(TransportException.class, () -> client.fetch("files/missing"));
        assertTrue(e.getMessage().contains("404"));
    }

    @Test
    @DisplayName("generate sends file references and a separate system instruction")
    void generate() throws IOException {
        var handle = new UploadedFileHandle("files/abc", "https://files/abc", "text/markdown",
                "notes.md", FileState.ACTIVE, null, Instant.now());

        String text = client.generate("gemini-2.5-flash", "Write the spec", "You are a designer", List.of(handle));

        assertEquals("# Atom Quest", text);
        JsonNode body = mapper.readTree(generateBody);
        JsonNode parts = body.path("contents").get(0).path("parts");
        assertEquals("user", body.path("contents").get(0).path("role").asText());
        assertEquals("Write the spec", parts.get(0).path("text").asText());
        assertEquals("https://files/abc", parts.get(1).path("fileData").path("fileUri").asText());
        assertEquals("You are a designer",
                body.path("systemInstruction").path("parts").get(0).path("text").asText());
    }

    @Test
    @DisplayName("a response without candidates yields empty text")
    void noCandidates() throws IOException {
        JsonNode blocked = mapper.readTree("{\"promptFeedback\": {\"blockReason\": \"SAFETY\"}}");
        assertEquals("", client.extractText(blocked));
    }
}
