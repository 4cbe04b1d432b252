package com.example.media_analyzer.engine;

import com.example.media_analyzer.config.AiProperties;
import com.example.media_analyzer.engine.Interfaces.TextAnalysisEngine;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.LinkedHashMap;
import java.util.Map;

public class OllamaTextAnalysisEngine implements TextAnalysisEngine {
    private final OllamaGenerateClient generate;
    private final AiProperties.Ollama props;

    public OllamaTextAnalysisEngine(WebClient client, AiProperties.Ollama props, ObjectMapper om) {
        this.generate = new OllamaGenerateClient(client, om, props.getTimeoutSeconds());
        this.props = props;
    }

    @Override
    public String analyze(Request request) throws Exception {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", props.getAnalysisModel());
        body.put("prompt", request.prompt());
        if (request.systemMessage() != null && !request.systemMessage().isBlank()) {
            body.put("system", request.systemMessage());
        }
        if ("json_object".equals(request.responseFormat())) {
            body.put("format", "json");
        }
        body.put("stream", false);
        body.put("options", Map.of("num_predict", request.maxTokens()));
        return generate.generate(body, "Ollama analysis");
    }
}
