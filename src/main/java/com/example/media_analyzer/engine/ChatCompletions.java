package com.example.media_analyzer.engine;

import com.example.media_analyzer.exception.TransportFailureException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

final class ChatCompletions {
    private ChatCompletions() {}

    /**
     * First choice's message content. A model-side refusal is returned as text so the caller's refusal policy sees it.
     */
    static String content(ObjectMapper om, String body, String call) {
        if (body == null || body.isBlank()) {
            throw new TransportFailureException("Empty response from " + call);
        }
        JsonNode root;
        try {
            root = om.readTree(body);
        } catch (JsonProcessingException e) {
            throw new TransportFailureException(call + " returned invalid JSON: " + EngineFailures.truncate(body, 200), e);
        }
        JsonNode message = root.path("choices").path(0).path("message");
        if (message.isMissingNode()) {
            throw new TransportFailureException(call + " response has no choices");
        }
        String content = message.path("content").asText("");
        if (content.isBlank() && message.hasNonNull("refusal")) {
            return message.get("refusal").asText("");
        }
        return content;
    }
}
