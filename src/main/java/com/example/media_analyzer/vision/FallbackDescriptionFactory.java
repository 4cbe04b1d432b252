package com.example.media_analyzer.vision;

import com.example.media_analyzer.util.JsonResponses;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds the locally synthesized description used when the provider refused twice or was unreachable.
 * The document carries every section a provider description has, so consumers never branch on its shape.
 */
public class FallbackDescriptionFactory {
    static final int SUMMARY_TRANSCRIPT_CHARS = 100;
    static final int CORRELATION_TRANSCRIPT_CHARS = 200;

    private final ObjectMapper mapper;

    public FallbackDescriptionFactory(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String create(SampledFrame frame, FrameContext context) {
        ObjectNode doc = mapper.createObjectNode();
        doc.put("fallback", true);
        doc.put("error", "Detailed analysis unavailable, fallback description generated");
        doc.put("summary", summary(frame, context));
        doc.put("screen_type", screenType(context));
        doc.put("module_name", "");
        doc.put("audio_correlation", frame.transcriptWindow().isBlank()
                ? "Not available"
                : JsonResponses.truncate(frame.transcriptWindow(), CORRELATION_TRANSCRIPT_CHARS));

        ObjectNode ocr = doc.putObject("ocr_extracted_texts");
        for (String key : List.of("headers", "buttons", "labels", "menu_items", "data_values", "messages")) {
            ocr.putArray(key);
        }
        ObjectNode layout = doc.putObject("layout_architecture");
        layout.put("grid_system", "unknown");
        for (String key : List.of("header_height", "navigation_type", "main_area", "color_scheme", "spacing_pattern")) {
            layout.put(key, "");
        }
        doc.putArray("components");
        doc.putObject("inferred_data_model").putArray("entities");
        ObjectNode api = doc.putObject("inferred_api");
        for (String key : List.of("get_endpoints", "post_endpoints", "put_endpoints", "delete_endpoints")) {
            api.putArray(key);
        }
        ObjectNode state = doc.putObject("current_state");
        state.put("mode", "unknown");
        for (String key : List.of("loaded_data", "active_selection", "active_filters", "modal_open")) {
            state.put(key, "");
        }
        ObjectNode action = doc.putObject("current_action");
        action.put("action", "unknown");
        for (String key : List.of("target_element", "user_intent", "next_step")) {
            action.put(key, "");
        }
        ObjectNode tech = doc.putObject("technology_hints");
        for (String key : List.of("ui_framework", "frontend_framework", "css_approach", "platform")) {
            tech.put(key, "unknown");
        }
        tech.putArray("design_patterns");
        ObjectNode transition = doc.putObject("transition_from_previous");
        for (String key : List.of("changed_elements", "new_elements", "removed_elements")) {
            transition.putArray(key);
        }
        transition.put("animation_detected", "");
        ObjectNode notes = doc.putObject("reconstruction_notes");
        notes.putArray("key_components");
        notes.putArray("complex_interactions");
        notes.put("state_management", "");
        notes.putArray("styling_notes");
        doc.putArray("detected_features");
        doc.put("confidence", "low");
        doc.put("analysis_notes", "Fallback description generated after a provider error or refusal");

        try {
            return mapper.writeValueAsString(doc);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Serialize fallback description failed", e);
        }
    }

    static String summary(SampledFrame frame, FrameContext context) {
        List<String> parts = new ArrayList<>();
        if (context.hasDomainContext()) {
            parts.add("Screen of the application " + context.domainContext().strip());
        }
        parts.add("at timestamp " + JsonResponses.clock(frame.timestampSeconds()));
        if (!frame.transcriptWindow().isBlank()) {
            parts.add("while the narration says: \"" + JsonResponses.truncate(frame.transcriptWindow(), SUMMARY_TRANSCRIPT_CHARS) + "...\"");
        }
        return String.join(". ", parts) + ".";
    }

    static String screenType(FrameContext context) {
        if (!context.hasDomainContext()) {
            return "unknown";
        }
        String lower = context.domainContext().toLowerCase(Locale.ROOT);
        if (containsAny(lower, "order", "ordini", "comande")) {
            return "order_management";
        }
        if (containsAny(lower, "payment", "checkout", "pagament", "cassa", "pago")) {
            return "payment";
        }
        if (lower.contains("dashboard")) {
            return "dashboard";
        }
        return "unknown";
    }

    private static boolean containsAny(String text, String... words) {
        for (String w : words) {
            if (text.contains(w)) return true;
        }
        return false;
    }
}
