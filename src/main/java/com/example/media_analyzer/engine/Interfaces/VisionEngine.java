package com.example.media_analyzer.engine.Interfaces;

import java.util.Map;

public interface VisionEngine {
    record Request(byte[] image, String mediaType, String prompt, Map<String, Object> context) {}

    /**
     * @return the provider's raw answer text; may be a refusal or prose instead of JSON.
     */
    String describe(Request req) throws Exception;
}
