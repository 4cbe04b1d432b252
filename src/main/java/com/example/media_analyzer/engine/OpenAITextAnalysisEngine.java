package com.example.media_analyzer.engine;

import com.example.media_analyzer.config.AiProperties;
import com.example.media_analyzer.engine.Interfaces.TextAnalysisEngine;
import com.example.media_analyzer.exception.TransportFailureException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class OpenAITextAnalysisEngine implements TextAnalysisEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAITextAnalysisEngine.class);
    private static final Duration RETRY_BACKOFF = Duration.ofMillis(200);
    private static final int RETRY_MAX_ATTEMPTS = 2;

    private final WebClient client;
    private final AiProperties.OpenAi props;
    private final ObjectMapper om;

    public OpenAITextAnalysisEngine(WebClient client, AiProperties.OpenAi props, ObjectMapper om) {
        this.client = client;
        this.props = props;
        this.om = om;
    }

    @Override
    public String analyze(Request request) throws Exception {
        List<Map<String, Object>> messages = new ArrayList<>();
        if (request.systemMessage() != null && !request.systemMessage().isBlank()) {
            messages.add(Map.of("role", "system", "content", request.systemMessage()));
        }
        messages.add(Map.of("role", "user", "content", request.prompt()));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", props.getAnalysisModel());
        body.put("messages", messages);
        body.put("max_completion_tokens", request.maxTokens());
        if (request.responseFormat() != null && !request.responseFormat().isBlank()) {
            body.put("response_format", Map.of("type", request.responseFormat()));
        }

        String response;
        try {
            response = client.post()
                    .uri("/v1/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, resp -> resp.bodyToMono(String.class).defaultIfEmpty("")
                            .map(err -> new TransportFailureException("OpenAI analysis error %s: %s".formatted(resp.statusCode(), EngineFailures.truncate(err, 500)))))
                    .bodyToMono(String.class)
                    .retryWhen(Retry.backoff(RETRY_MAX_ATTEMPTS, RETRY_BACKOFF)
                            .filter(EngineFailures::isTransient)
                            .doBeforeRetry(signal -> LOGGER.warn("OpenAI analysis retry attempt={} err={}",
                                    signal.totalRetriesInARow() + 1, String.valueOf(signal.failure()))))
                    .block(Duration.ofSeconds(props.getTimeoutSeconds()));
        } catch (RuntimeException e) {
            throw EngineFailures.transport("OpenAI analysis", e);
        }
        return ChatCompletions.content(om, response, "OpenAI analysis");
    }
}
