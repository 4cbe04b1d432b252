package com.example.media_analyzer.engine;

import com.example.media_analyzer.config.AiProperties;
import com.example.media_analyzer.engine.Interfaces.VisionEngine;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Local vision model served by Ollama ({@code /api/generate} with base64 images).
 */
public class OllamaVisionEngine implements VisionEngine {
    private final OllamaGenerateClient generate;
    private final AiProperties.Ollama props;
    private final int maxTokens;

    public OllamaVisionEngine(WebClient client, AiProperties.Ollama props, int maxTokens, ObjectMapper om) {
        this.generate = new OllamaGenerateClient(client, om, props.getTimeoutSeconds());
        this.props = props;
        this.maxTokens = maxTokens;
    }

    @Override
    public String describe(Request request) throws Exception {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", props.getVisionModel());
        body.put("prompt", request.prompt());
        body.put("images", List.of(Base64.getEncoder().encodeToString(request.image())));
        body.put("stream", false);
        body.put("options", Map.of("num_predict", maxTokens));
        return generate.generate(body, "Ollama vision");
    }
}
