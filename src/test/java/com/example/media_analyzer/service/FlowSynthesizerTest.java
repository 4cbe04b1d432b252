package com.example.media_analyzer.service;

import com.example.media_analyzer.config.PipelineProperties;
import com.example.media_analyzer.dto.media.AnalyzedFrame;
import com.example.media_analyzer.dto.media.SynthesisResult;
import com.example.media_analyzer.dto.media.TopicSpan;
import com.example.media_analyzer.dto.media.TranscriptEnrichment;
import com.example.media_analyzer.engine.Interfaces.TextAnalysisEngine;
import com.example.media_analyzer.exception.TransportFailureException;
import com.example.media_analyzer.util.AnalysisMode;
import com.example.media_analyzer.util.ExtractionMethod;
import com.example.media_analyzer.vision.FrameDescription;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FlowSynthesizerTest {

    @Mock
    private TextAnalysisEngine analysis;

    private FlowSynthesizer synthesizer;

    @BeforeEach
    void setUp() {
        PipelineProperties props = new PipelineProperties();
        props.setFlowMaxFrames(2);
        synthesizer = new FlowSynthesizer(analysis, new ObjectMapper(), props);
    }

    private static AnalyzedFrame frame(int index, double ts, String text) {
        return new AnalyzedFrame(index, ts, (long) (ts * 25), ExtractionMethod.UNIFORM, 0, null, null,
                FrameDescription.accepted(text, 1));
    }

    @Test
    void videoSynthesisListsFramesAndCapsThem() throws Exception {
        when(analysis.analyze(any())).thenReturn("{\"summary\":\"An order management app\",\"modules\":[]}");
        List<AnalyzedFrame> frames = List.of(
                frame(0, 1.5, "{\"summary\":\"Login\",\"screen_type\":\"login\"}"),
                frame(1, 6.0, "plain prose"),
                frame(2, 12.0, "{\"summary\":\"Orders\"}"));

        SynthesisResult result = synthesizer.synthesizeVideo("hello world", frames, 30.0, "demo.mp4", "Restaurant POS");

        assertThat(result.mode()).isEqualTo(AnalysisMode.REVERSE_ENGINEERING);
        assertThat(result.summary()).isEqualTo("An order management app");

        ArgumentCaptor<TextAnalysisEngine.Request> captor = ArgumentCaptor.forClass(TextAnalysisEngine.Request.class);
        verify(analysis).analyze(captor.capture());
        String prompt = captor.getValue().prompt();
        assertThat(prompt)
                .contains("Context: Restaurant POS")
                .contains("[1.50s] [login] | Login")
                .contains("[6.00s] plain prose")
                .contains("+1 more frames not shown")
                .doesNotContain("Orders");
        assertThat(captor.getValue().responseFormat()).isEqualTo("json_object");
    }

    @Test
    void unparseableSynthesisIsKeptRaw() throws Exception {
        when(analysis.analyze(any())).thenReturn("sorry, no json today");

        SynthesisResult result = synthesizer.synthesizeVideo("", List.of(), 10.0, null, null);

        assertThat(result.document().path("raw_response").asText()).isEqualTo("sorry, no json today");
        assertThat(result.document().has("parse_error")).isTrue();
        assertThat(result.summary()).isEmpty();
    }

    @Test
    void providerFailurePropagatesAsTransportFailure() throws Exception {
        when(analysis.analyze(any())).thenThrow(new IllegalStateException("503"));

        assertThrows(TransportFailureException.class,
                () -> synthesizer.synthesizeVideo("text", List.of(), 10.0, "a.mp4", null));
    }

    @Test
    void audioSynthesisInfersModeWhenAuto() throws Exception {
        when(analysis.analyze(any()))
                .thenReturn("{\"content_type\":\"meeting\",\"confidence\":\"high\"}")
                .thenReturn("{\"summary\":\"Weekly sync\",\"decisions\":[]}");
        TranscriptEnrichment enrichment = new TranscriptEnrichment(true, "Team sync",
                List.of(new TopicSpan("Budget", 0, Double.MAX_VALUE, "Q3 budget")), List.of("budget"), "neutral", 3, null, null);

        SynthesisResult result = synthesizer.synthesizeAudio("we decided", enrichment, 120.0, "sync.mp3", null, AnalysisMode.AUTO);

        assertThat(result.mode()).isEqualTo(AnalysisMode.MEETING);
        assertThat(result.document().path("_analysis_type").asText()).isEqualTo("meeting");
        assertThat(result.summary()).isEqualTo("Weekly sync");

        ArgumentCaptor<TextAnalysisEngine.Request> captor = ArgumentCaptor.forClass(TextAnalysisEngine.Request.class);
        verify(analysis, times(2)).analyze(captor.capture());
        assertThat(captor.getAllValues().get(1).prompt())
                .contains("Speakers detected: 3")
                .contains("- [0s - 120s] Budget: Q3 budget")
                .contains("action_items");
    }

    @Test
    void explicitModeSkipsInference() throws Exception {
        when(analysis.analyze(any())).thenReturn("{\"summary\":\"Ideas\"}");

        SynthesisResult result = synthesizer.synthesizeAudio("idea one", TranscriptEnrichment.notEnriched(null), 60.0,
                "ideas.wav", null, AnalysisMode.BRAINSTORMING);

        assertThat(result.mode()).isEqualTo(AnalysisMode.BRAINSTORMING);
        verify(analysis, times(1)).analyze(any());
    }

    @Test
    void inferModeDefaultsToNotes() throws Exception {
        when(analysis.analyze(any()))
                .thenThrow(new IllegalStateException("down"))
                .thenReturn("{\"content_type\":\"podcast\"}")
                .thenReturn("not json");

        assertThat(synthesizer.inferMode("text", null)).isEqualTo(AnalysisMode.NOTES);
        assertThat(synthesizer.inferMode("text", null)).isEqualTo(AnalysisMode.NOTES);
        assertThat(synthesizer.inferMode("text", null)).isEqualTo(AnalysisMode.NOTES);
    }

    @Test
    void compactSummaryIsBounded() {
        StringBuilder longSummary = new StringBuilder();
        for (int i = 0; i < 200; i++) longSummary.append("word ");
        String description = "{\"summary\":\"" + longSummary + "\",\"screen_type\":\"dashboard\",\"module_name\":\"Reports\",\"audio_correlation\":\"" + longSummary + "\"}";

        String compact = synthesizer.compactSummary(description);

        assertThat(compact).startsWith("[dashboard] | Module: Reports | ");
        assertThat(compact.length()).isLessThanOrEqualTo(500);
        assertThat(synthesizer.compactSummary(null)).isEqualTo("Description not available");
    }

    @Test
    void truncateTranscriptMarksCut() {
        List<String> words = new ArrayList<>();
        for (int i = 0; i < 50; i++) words.add("abcdefghij");
        String transcript = String.join("", words);

        String cut = FlowSynthesizer.truncateTranscript(transcript, 100);

        assertThat(cut).startsWith(transcript.substring(0, 100)).endsWith("[transcript truncated]");
        assertThat(FlowSynthesizer.truncateTranscript("short", 100)).isEqualTo("short");
    }
}
