package com.example.media_analyzer.engine;

import com.example.media_analyzer.config.AiProperties;
import com.example.media_analyzer.engine.Interfaces.VisionEngine;
import com.example.media_analyzer.exception.TransportFailureException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * Chat completions with an inline image. No transport retry here: the frame describer owns the retry budget.
 */
public class OpenAIVisionEngine implements VisionEngine {
    static final String SYSTEM_MESSAGE = "You are an expert UI/UX analyst. You describe application screenshots precisely and answer in JSON.";

    private final WebClient client;
    private final AiProperties.OpenAi props;
    private final ObjectMapper om;

    public OpenAIVisionEngine(WebClient client, AiProperties.OpenAi props, ObjectMapper om) {
        this.client = client;
        this.props = props;
        this.om = om;
    }

    @Override
    public String describe(Request request) throws Exception {
        String dataUrl = "data:" + request.mediaType() + ";base64," + Base64.getEncoder().encodeToString(request.image());
        Map<String, Object> body = Map.of(
                "model", props.getVisionModel(),
                "max_completion_tokens", props.getVisionMaxTokens(),
                "messages", List.of(
                        Map.of("role", "system", "content", SYSTEM_MESSAGE),
                        Map.of("role", "user", "content", List.of(
                                Map.of("type", "text", "text", request.prompt()),
                                Map.of("type", "image_url", "image_url", Map.of("url", dataUrl, "detail", "high"))))));
        String response;
        try {
            response = client.post()
                    .uri("/v1/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, resp -> resp.bodyToMono(String.class).defaultIfEmpty("")
                            .map(err -> new TransportFailureException("OpenAI vision error %s: %s".formatted(resp.statusCode(), EngineFailures.truncate(err, 500)))))
                    .bodyToMono(String.class)
                    .block(Duration.ofSeconds(props.getTimeoutSeconds()));
        } catch (RuntimeException e) {
            throw EngineFailures.transport("OpenAI vision", e);
        }
        return ChatCompletions.content(om, response, "OpenAI vision");
    }
}
