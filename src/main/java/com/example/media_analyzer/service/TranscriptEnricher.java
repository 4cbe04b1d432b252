package com.example.media_analyzer.service;

import com.example.media_analyzer.dto.media.TopicSpan;
import com.example.media_analyzer.dto.media.TranscriptEnrichment;
import com.example.media_analyzer.engine.Interfaces.TextAnalysisEngine;
import com.example.media_analyzer.engine.Interfaces.TranscriptionEngine;
import com.example.media_analyzer.util.JsonResponses;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Adds topics with time spans, keywords, tone and a semantic summary to a raw transcript.
 * Enrichment is optional: any provider failure yields {@code enriched=false} and the pipeline goes on.
 */
@Service
public class TranscriptEnricher {
    private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptEnricher.class);
    static final int MAX_TOKENS = 2000;

    static final String SYSTEM_MESSAGE = """
            You analyse transcripts of recorded sessions. You identify the topics discussed with their time spans, \
            the keywords that help correlate narration with what is shown on screen, and the tone of the speaker. \
            You always answer with a single JSON object.""";

    private final TextAnalysisEngine analysis;
    private final ObjectMapper mapper;

    public TranscriptEnricher(TextAnalysisEngine analysis, ObjectMapper mapper) {
        this.analysis = analysis;
        this.mapper = mapper;
    }

    public TranscriptEnrichment enrich(TranscriptionEngine.Result transcript, double durationSeconds, String fileName) {
        if (transcript == null || transcript.text() == null || transcript.text().isBlank()) {
            LOGGER.info("ENRICH skipped: empty transcript");
            return TranscriptEnrichment.notEnriched(null);
        }
        String prompt = prompt(transcript, durationSeconds, fileName);
        String response;
        try {
            response = analysis.analyze(new TextAnalysisEngine.Request(prompt, SYSTEM_MESSAGE, MAX_TOKENS, "json_object"));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return TranscriptEnrichment.notEnriched("interrupted");
        } catch (Exception e) {
            LOGGER.warn("ENRICH failed, continuing with raw transcript err={}", e.toString());
            return TranscriptEnrichment.notEnriched(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
        ObjectNode doc = JsonResponses.extractObject(mapper, response);
        if (doc.has("parse_error")) {
            LOGGER.warn("ENRICH response not parseable err={}", doc.path("parse_error").asText());
            return TranscriptEnrichment.notEnriched("unparseable enrichment response: " + doc.path("parse_error").asText());
        }
        TranscriptEnrichment result = new TranscriptEnrichment(true,
                doc.path("semantic_summary").asText(""),
                topics(doc.path("topics")),
                strings(doc.path("keywords")),
                doc.path("tone").asText("unknown"),
                Math.max(1, doc.path("speakers_detected").asInt(1)),
                null,
                doc);
        LOGGER.info("ENRICH done topics={} keywords={}", result.topics().size(), result.keywords().size());
        return result;
    }

    String prompt(TranscriptionEngine.Result transcript, double durationSeconds, String fileName) {
        String segments = transcript.segments().stream()
                .map(s -> String.format(Locale.ROOT, "[%.1fs - %.1fs]: %s", s.start(), s.end(), s.text()))
                .collect(Collectors.joining("\n"));
        return """
                File: %s
                Duration: %.1f seconds

                Full transcript:
                %s

                Timed segments:
                %s

                Return JSON with: "semantic_summary" (string), "topics" (array of {"topic", "start_time", "end_time", \
                "description"} with times in seconds), "keywords" (array of strings), "tone" (string), \
                "speakers_detected" (integer).""".formatted(
                fileName == null || fileName.isBlank() ? "recording" : fileName,
                durationSeconds, transcript.text(), segments.isEmpty() ? "(none)" : segments);
    }

    private static List<TopicSpan> topics(JsonNode node) {
        List<TopicSpan> out = new ArrayList<>();
        for (JsonNode t : node) {
            String topic = t.path("topic").asText("");
            if (topic.isBlank()) continue;
            double start = t.path("start_time").asDouble(0);
            double end = t.hasNonNull("end_time") ? t.path("end_time").asDouble(Double.MAX_VALUE) : Double.MAX_VALUE;
            out.add(new TopicSpan(topic, start, Math.max(start, end), t.path("description").asText("")));
        }
        return out;
    }

    private static List<String> strings(JsonNode node) {
        List<String> out = new ArrayList<>();
        for (JsonNode n : node) {
            String s = n.asText("").strip();
            if (!s.isEmpty()) out.add(s);
        }
        return out;
    }
}
