package com.example.media_analyzer.service;

import com.example.media_analyzer.config.PipelineProperties;
import com.example.media_analyzer.dto.media.AnalyzedFrame;
import com.example.media_analyzer.dto.media.SynthesisResult;
import com.example.media_analyzer.dto.media.TopicSpan;
import com.example.media_analyzer.dto.media.TranscriptEnrichment;
import com.example.media_analyzer.engine.Interfaces.TextAnalysisEngine;
import com.example.media_analyzer.exception.TransportFailureException;
import com.example.media_analyzer.util.AnalysisMode;
import com.example.media_analyzer.util.JsonResponses;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Final synthesis of a job: one text-analysis call over the transcript and, for videos, the frame summaries.
 * An unparseable answer is kept as {@code {raw_response, parse_error}}; a provider failure propagates.
 */
@Service
public class FlowSynthesizer {
    private static final Logger LOGGER = LoggerFactory.getLogger(FlowSynthesizer.class);

    static final int MAX_TOKENS = 4000;
    static final int INFER_MAX_TOKENS = 500;
    static final int INFER_TRANSCRIPT_CHARS = 4000;
    static final int FRAME_SUMMARY_CHARS = 500;
    static final int MAX_TOPICS = 10;
    static final int MAX_KEYWORDS = 20;
    static final int SEMANTIC_SUMMARY_CHARS = 1500;
    static final String TRUNCATION_MARK = "\n... [transcript truncated]";

    private static final String FLOW_SYSTEM = """
            You are a software analyst reconstructing an application from a narrated screen recording. \
            You answer with a single JSON object.""";
    private static final String INFER_SYSTEM = """
            You classify recordings. Answer with a JSON object {"content_type", "confidence", "reasoning"}.""";
    private static final Map<AnalysisMode, String> AUDIO_FOCUS = audioFocus();

    private final TextAnalysisEngine analysis;
    private final ObjectMapper mapper;
    private final PipelineProperties props;

    public FlowSynthesizer(TextAnalysisEngine analysis, ObjectMapper mapper, PipelineProperties props) {
        this.analysis = analysis;
        this.mapper = mapper;
        this.props = props;
    }

    public SynthesisResult synthesizeVideo(String transcript, List<AnalyzedFrame> frames, double durationSeconds,
                                           String fileName, String context) throws InterruptedException {
        String text = truncateTranscript(transcript, props.getFlowTranscriptChars());
        int limit = props.getFlowMaxFrames();
        String framesBlock = frames.stream()
                .limit(limit)
                .map(f -> String.format(Locale.ROOT, "[%.2fs] %s", f.timestampSeconds(), compactSummary(f.description().text())))
                .collect(Collectors.joining("\n"));
        if (frames.size() > limit) {
            framesBlock += "\n... [+" + (frames.size() - limit) + " more frames not shown]";
        }
        LOGGER.info("SYNTH video transcriptChars={} frames={}/{}", text.length(), Math.min(limit, frames.size()), frames.size());

        String prompt = """
                %sFile: %s
                Duration: %.1f seconds

                Transcript:
                %s

                Screens in order:
                %s

                Return JSON with: "summary", "app_type", "modules", "user_flows", "issues_and_observations", \
                "technology_hints", "recommendations".""".formatted(
                contextLine(context), displayName(fileName), durationSeconds,
                text.isBlank() ? "(no transcript available)" : text,
                framesBlock.isBlank() ? "(no screens available)" : framesBlock);

        ObjectNode doc = call(prompt, FLOW_SYSTEM, "video synthesis");
        return new SynthesisResult(AnalysisMode.REVERSE_ENGINEERING, doc, doc.path("summary").asText(""));
    }

    public SynthesisResult synthesizeAudio(String transcript, TranscriptEnrichment enrichment, double durationSeconds,
                                           String fileName, String context, AnalysisMode requested) throws InterruptedException {
        AnalysisMode mode = requested == null || requested == AnalysisMode.AUTO ? inferMode(transcript, context) : requested;
        String text = truncateTranscript(transcript, props.getAudioTranscriptChars());
        List<TopicSpan> topics = enrichment.topics();
        String topicsBlock = topics.stream()
                .limit(MAX_TOPICS)
                .map(t -> String.format(Locale.ROOT, "- [%.0fs - %.0fs] %s: %s", t.startTime(),
                        t.endTime() == Double.MAX_VALUE ? durationSeconds : t.endTime(), t.topic(),
                        JsonResponses.truncate(t.description(), 150)))
                .collect(Collectors.joining("\n"));
        if (topics.size() > MAX_TOPICS) {
            topicsBlock += "\n... [+" + (topics.size() - MAX_TOPICS) + " more topics]";
        }
        String keywords = enrichment.keywords().stream().limit(MAX_KEYWORDS).collect(Collectors.joining(", "));
        LOGGER.info("SYNTH audio mode={} transcriptChars={} topics={}", mode, text.length(), Math.min(MAX_TOPICS, topics.size()));

        String prompt = """
                %sFile: %s
                Duration: %s (%d minutes)
                Speakers detected: %d
                Tone: %s

                Semantic summary:
                %s

                Topics:
                %s

                Keywords: %s

                Transcript:
                %s

                %s""".formatted(
                contextLine(context), displayName(fileName), JsonResponses.clock(durationSeconds), (int) (durationSeconds / 60),
                enrichment.speakersDetected(), enrichment.tone(),
                JsonResponses.truncate(enrichment.semanticSummary(), SEMANTIC_SUMMARY_CHARS),
                topicsBlock.isBlank() ? "(no topics identified)" : topicsBlock,
                keywords.isBlank() ? "(none)" : keywords,
                text.isBlank() ? "(no transcript available)" : text,
                AUDIO_FOCUS.get(mode));

        ObjectNode doc = call(prompt, "You structure spoken recordings into useful documents. You answer with a single JSON object.", "audio synthesis");
        doc.put("_analysis_type", mode.toJson());
        return new SynthesisResult(mode, doc, doc.path("summary").asText(""));
    }

    /**
     * Guesses the content type of an audio recording. Never throws: any failure means {@link AnalysisMode#NOTES}.
     */
    public AnalysisMode inferMode(String transcript, String context) throws InterruptedException {
        String text = transcript == null ? "" : transcript;
        if (text.length() > INFER_TRANSCRIPT_CHARS) {
            text = text.substring(0, INFER_TRANSCRIPT_CHARS) + TRUNCATION_MARK;
        }
        String prompt = """
                User context: %s

                Transcript:
                %s

                Choose "content_type" among: reverse_engineering, meeting, debrief, brainstorming, notes.""".formatted(
                context == null || context.isBlank() ? "(none)" : context, text);
        try {
            String response = analysis.analyze(new TextAnalysisEngine.Request(prompt, INFER_SYSTEM, INFER_MAX_TOKENS, "json_object"));
            ObjectNode doc = JsonResponses.extractObject(mapper, response);
            AnalysisMode mode = AnalysisMode.fromJson(doc.path("content_type").asText("notes"));
            if (mode == AnalysisMode.AUTO) {
                mode = AnalysisMode.NOTES;
            }
            LOGGER.info("SYNTH inferred mode={} confidence={}", mode, doc.path("confidence").asText("unknown"));
            return mode;
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            LOGGER.warn("SYNTH mode inference failed, defaulting to notes err={}", e.toString());
            return AnalysisMode.NOTES;
        }
    }

    /**
     * Short form of a frame description for the synthesis prompt, at most 500 characters.
     */
    String compactSummary(String description) {
        if (description == null || description.isBlank()) {
            return "Description not available";
        }
        ObjectNode doc = JsonResponses.tryParseObject(mapper, description);
        if (doc == null) {
            return JsonResponses.truncate(description.replace('\n', ' ').replace("  ", " "), 400);
        }
        String summary = doc.path("summary").asText("");
        List<String> parts = new ArrayList<>();
        String screenType = doc.path("screen_type").asText("");
        String module = doc.path("module_name").asText("");
        String audio = doc.path("audio_correlation").asText("");
        if (!screenType.isBlank()) parts.add("[" + screenType + "]");
        if (!module.isBlank()) parts.add("Module: " + module);
        if (!summary.isBlank()) parts.add(JsonResponses.truncate(summary, 250));
        if (!audio.isBlank()) parts.add("Audio: " + JsonResponses.truncate(audio, 100));
        String joined = parts.isEmpty() ? JsonResponses.truncate(summary, 400) : String.join(" | ", parts);
        return JsonResponses.truncate(joined, FRAME_SUMMARY_CHARS);
    }

    private ObjectNode call(String prompt, String system, String what) throws InterruptedException {
        String response;
        try {
            response = analysis.analyze(new TextAnalysisEngine.Request(prompt, system, MAX_TOKENS, "json_object"));
        } catch (InterruptedException | TransportFailureException e) {
            throw e;
        } catch (Exception e) {
            throw new TransportFailureException(what + " failed: " + e.getMessage(), e);
        }
        ObjectNode doc = JsonResponses.extractObject(mapper, response);
        if (doc.has("parse_error")) {
            LOGGER.warn("SYNTH {} response not JSON, keeping raw err={}", what, doc.path("parse_error").asText());
        }
        return doc;
    }

    static String truncateTranscript(String transcript, int max) {
        if (transcript == null) return "";
        if (transcript.length() <= max) return transcript;
        LOGGER.warn("SYNTH transcript truncated from={} to={}", transcript.length(), max);
        return transcript.substring(0, max) + TRUNCATION_MARK;
    }

    private static String contextLine(String context) {
        return context == null || context.isBlank() ? "" : "Context: " + context.strip() + "\n";
    }

    private static String displayName(String fileName) {
        return fileName == null || fileName.isBlank() ? "recording" : fileName;
    }

    private static Map<AnalysisMode, String> audioFocus() {
        Map<AnalysisMode, String> m = new EnumMap<>(AnalysisMode.class);
        m.put(AnalysisMode.MEETING, "Return JSON with: \"summary\", \"participants\", \"agenda\", \"decisions\", \"action_items\" (each with owner and deadline when stated), \"open_questions\".");
        m.put(AnalysisMode.DEBRIEF, "Return JSON with: \"summary\", \"what_went_well\", \"what_went_wrong\", \"lessons_learned\", \"improvements\".");
        m.put(AnalysisMode.BRAINSTORMING, "Return JSON with: \"summary\", \"ideas\" (grouped by category), \"most_promising\", \"next_steps\".");
        m.put(AnalysisMode.NOTES, "Return JSON with: \"summary\", \"key_points\", \"details\", \"follow_ups\".");
        m.put(AnalysisMode.REVERSE_ENGINEERING, "Return JSON with: \"summary\", \"audio_type\", \"speakers\", \"topics\", \"action_items\", \"decisions\", \"recommendations\".");
        return m;
    }
}
