package com.crosscheck.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Minimal HTTP client the CLI uses to talk to a running Crosscheck server on localhost.
 */
@Component
public class CrosscheckClient {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();

    public ApiResponse get(int port, String path) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri(port, path))
                .header("Accept", "application/json")
                .GET()
                .build();
        return send(request);
    }

    public ApiResponse post(int port, String path, Object body) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri(port, path))
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(OBJECT_MAPPER.writeValueAsString(body)))
                .build();
        return send(request);
    }

    private ApiResponse send(HttpRequest request) throws IOException, InterruptedException {
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        String body = response.body();
        JsonNode json = body == null || body.isBlank()
                ? OBJECT_MAPPER.createObjectNode()
                : OBJECT_MAPPER.readTree(body);
        return new ApiResponse(response.statusCode(), json);
    }

    private static URI uri(int port, String path) {
        return URI.create("http://localhost:" + port + path);
    }

    public record ApiResponse(int status, JsonNode body) {

        public String error() {
            JsonNode error = body.get("error");
            return error != null ? error.asText() : "HTTP " + status;
        }
    }
}
