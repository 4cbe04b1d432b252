package com.example.media_analyzer.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Locale;

/**
 * Helpers for model responses that are supposed to be JSON but may arrive wrapped in markdown fences
 * or surrounded by prose.
 */
public final class JsonResponses {
    private JsonResponses() {}

    /**
     * Parses the first JSON object found in the text. Never throws: an unparseable response is returned as
     * {@code {"raw_response": ..., "parse_error": ...}}.
     */
    public static ObjectNode extractObject(ObjectMapper mapper, String text) {
        String candidate = stripFences(text == null ? "" : text);
        try {
            JsonNode node = mapper.readTree(candidate);
            if (node != null && node.isObject()) {
                return (ObjectNode) node;
            }
            ObjectNode wrapper = mapper.createObjectNode();
            wrapper.put("raw_response", text);
            wrapper.put("parse_error", "response is not a JSON object");
            return wrapper;
        } catch (JsonProcessingException e) {
            ObjectNode wrapper = mapper.createObjectNode();
            wrapper.put("raw_response", text);
            wrapper.put("parse_error", e.getOriginalMessage());
            return wrapper;
        }
    }

    /**
     * Like {@link #extractObject} but returns {@code null} instead of a wrapper when the text holds no object.
     */
    public static ObjectNode tryParseObject(ObjectMapper mapper, String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            JsonNode node = mapper.readTree(stripFences(text));
            return node != null && node.isObject() ? (ObjectNode) node : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    static String stripFences(String text) {
        String body = text.strip();
        int fence = body.indexOf("```");
        if (fence >= 0) {
            int start = body.indexOf('\n', fence);
            int end = body.indexOf("```", fence + 3);
            if (start >= 0 && end > start) {
                body = body.substring(start + 1, end).strip();
            } else {
                body = body.replace("```json", "").replace("```", "").strip();
            }
        }
        int open = body.indexOf('{');
        int close = body.lastIndexOf('}');
        if (open >= 0 && close > open) {
            return body.substring(open, close + 1);
        }
        return body;
    }

    public static String truncate(String value, int max) {
        if (value == null) return "";
        if (value.length() <= max) return value;
        return value.substring(0, max);
    }

    /** Formats seconds as {@code m:ss}. */
    public static String clock(double seconds) {
        int total = (int) Math.max(0, seconds);
        return String.format(Locale.ROOT, "%d:%02d", total / 60, total % 60);
    }
}
