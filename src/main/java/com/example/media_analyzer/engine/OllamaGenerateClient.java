package com.example.media_analyzer.engine;

import com.example.media_analyzer.exception.TransportFailureException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Map;

/**
 * Non-streaming call to Ollama's generate endpoint.
 */
final class OllamaGenerateClient {
    private final WebClient client;
    private final ObjectMapper om;
    private final Duration timeout;

    OllamaGenerateClient(WebClient client, ObjectMapper om, long timeoutSeconds) {
        this.client = client;
        this.om = om;
        this.timeout = Duration.ofSeconds(timeoutSeconds);
    }

    String generate(Map<String, Object> body, String call) {
        String response;
        try {
            response = client.post()
                    .uri("/api/generate")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, resp -> resp.bodyToMono(String.class).defaultIfEmpty("")
                            .map(err -> new TransportFailureException("%s error %s: %s".formatted(call, resp.statusCode(), EngineFailures.truncate(err, 500)))))
                    .bodyToMono(String.class)
                    .block(timeout);
        } catch (RuntimeException e) {
            throw EngineFailures.transport(call, e);
        }
        if (response == null || response.isBlank()) {
            throw new TransportFailureException("Empty response from " + call);
        }
        try {
            JsonNode root = om.readTree(response);
            if (root.hasNonNull("error")) {
                throw new TransportFailureException(call + " error: " + root.get("error").asText());
            }
            return root.path("response").asText("");
        } catch (JsonProcessingException e) {
            throw new TransportFailureException(call + " returned invalid JSON: " + EngineFailures.truncate(response, 200), e);
        }
    }
}
