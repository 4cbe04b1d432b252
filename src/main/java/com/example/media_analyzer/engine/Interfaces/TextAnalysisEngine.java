package com.example.media_analyzer.engine.Interfaces;

public interface TextAnalysisEngine {
    /**
     * @param responseFormat {@code "json_object"} to ask for strict JSON, or {@code null}.
     */
    record Request(String prompt, String systemMessage, int maxTokens, String responseFormat) {}

    String analyze(Request req) throws Exception;
}
