package com.example.media_analyzer.vision;

import com.example.media_analyzer.util.JsonResponses;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the prompts sent to the vision provider for one frame.
 */
public class FramePromptBuilder {
    static final int MAX_KEYWORDS = 10;
    static final int HINT_SUMMARY_CHARS = 200;
    static final int HINT_RAW_CHARS = 300;

    static final String SIMPLIFIED_PROMPT = """
            Describe this application screenshot as JSON.
            Focus on what is visible: texts, buttons, layout and UI components.
            Always answer with a single valid JSON object with at least the fields \
            "summary", "screen_type", "module_name" and "components".""";

    private static final Map<String, List<String>> FEATURE_KEYWORDS = featureKeywords();

    private final ObjectMapper mapper;

    public FramePromptBuilder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String contextual(SampledFrame frame, FrameContext context) {
        List<String> parts = new ArrayList<>();
        if (context.hasDomainContext()) {
            parts.add("Application: " + context.domainContext().strip());
            List<String> features = detectFeatures(context.domainContext());
            if (!features.isEmpty()) {
                parts.add("Key features mentioned in the context: " + String.join(", ", features));
            }
        }
        double ts = frame.timestampSeconds();
        parts.add(String.format(Locale.ROOT, "Timestamp: %s (%.1fs)", JsonResponses.clock(ts), ts));
        if (!frame.transcriptWindow().isBlank()) {
            parts.add("Narration at this moment:\n\"" + frame.transcriptWindow() + "\"");
        }
        if (!frame.topicsInWindow().isEmpty()) {
            parts.add("Topics being discussed: " + String.join(", ", frame.topicsInWindow()));
        }
        if (!context.keywords().isEmpty()) {
            parts.add("Keywords: " + String.join(", ", context.keywords().subList(0, Math.min(MAX_KEYWORDS, context.keywords().size()))));
        }
        parts.addAll(continuityLines(frame.continuityHint()));

        return """
                You are analysing a frame of a screen recording in which an application is demonstrated.
                Correlate what you see with the narration and describe the screen.

                %s

                Answer with a single JSON object containing: "summary", "screen_type", "module_name", \
                "audio_correlation", "ocr_extracted_texts", "layout_architecture", "components", \
                "current_action", "technology_hints", "transition_from_previous", "detected_features" \
                and "confidence".""".formatted(String.join("\n", parts));
    }

    public String simplified() {
        return SIMPLIFIED_PROMPT;
    }

    /**
     * Context map handed to the provider alongside the prompt.
     */
    public Map<String, Object> providerContext(SampledFrame frame, FrameContext context) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("timestamp", frame.timestampSeconds());
        ctx.put("transcript_segment", frame.transcriptWindow());
        ctx.put("topics", frame.topicsInWindow());
        ctx.put("keywords", context.keywords());
        ctx.put("previous_frame_description", frame.continuityHint());
        ctx.put("context", context.domainContext());
        return ctx;
    }

    List<String> continuityLines(String hint) {
        if (hint == null || hint.isBlank()) {
            return List.of();
        }
        ObjectNode previous = JsonResponses.tryParseObject(mapper, hint);
        if (previous == null) {
            String raw = hint.length() > HINT_RAW_CHARS ? hint.substring(0, HINT_RAW_CHARS) + "..." : hint;
            return List.of("Previous frame: " + raw);
        }
        List<String> lines = new ArrayList<>();
        String summary = JsonResponses.truncate(previous.path("summary").asText(""), HINT_SUMMARY_CHARS);
        String module = previous.path("module_name").asText("");
        if (!summary.isBlank()) {
            lines.add("Previous frame summary: " + summary);
        }
        if (!module.isBlank()) {
            lines.add("Previous frame module: " + module);
        }
        return lines;
    }

    static List<String> detectFeatures(String domainContext) {
        String lower = domainContext.toLowerCase(Locale.ROOT);
        List<String> found = new ArrayList<>();
        FEATURE_KEYWORDS.forEach((feature, words) -> {
            if (words.stream().anyMatch(lower::contains)) {
                found.add(feature);
            }
        });
        return found;
    }

    private static Map<String, List<String>> featureKeywords() {
        Map<String, List<String>> map = new LinkedHashMap<>();
        map.put("order management", List.of("order", "ordini", "comande"));
        map.put("payments", List.of("payment", "checkout", "pagament", "cassa"));
        map.put("inventory", List.of("inventory", "stock", "warehouse", "magazzino"));
        map.put("customers", List.of("customer", "client"));
        map.put("invoicing", List.of("invoice", "billing", "fattur"));
        map.put("reporting", List.of("report", "statistic", "analytics"));
        return map;
    }
}
