package com.example.media_analyzer.service;

import com.example.media_analyzer.dto.media.TranscriptEnrichment;
import com.example.media_analyzer.engine.Interfaces.TextAnalysisEngine;
import com.example.media_analyzer.engine.Interfaces.TranscriptionEngine;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TranscriptEnricherTest {

    @Mock
    private TextAnalysisEngine analysis;

    private final TranscriptionEngine.Result transcript = new TranscriptionEngine.Result(
            "Hello, today we look at orders.",
            List.of(new TranscriptionEngine.Segment(0, 3, "Hello,"), new TranscriptionEngine.Segment(3, 7, "today we look at orders.")),
            "en", "dummy");

    @Test
    void parsesTopicsAndKeywords() throws Exception {
        when(analysis.analyze(any())).thenReturn("""
                {"semantic_summary":"Order walkthrough",
                 "topics":[{"topic":"Orders","start_time":3,"end_time":7,"description":"list"},
                           {"topic":"Wrap up","start_time":7}],
                 "keywords":["orders"," ", "list"],
                 "tone":"informal","speakers_detected":0}""");

        TranscriptEnrichment enrichment = new TranscriptEnricher(analysis, new ObjectMapper()).enrich(transcript, 7, "demo.mp4");

        assertThat(enrichment.enriched()).isTrue();
        assertThat(enrichment.semanticSummary()).isEqualTo("Order walkthrough");
        assertThat(enrichment.topics()).hasSize(2);
        assertThat(enrichment.topics().get(1).endTime()).isEqualTo(Double.MAX_VALUE);
        assertThat(enrichment.keywords()).containsExactly("orders", "list");
        assertThat(enrichment.speakersDetected()).isEqualTo(1);
    }

    @Test
    void failureLeavesTranscriptUnenriched() throws Exception {
        when(analysis.analyze(any())).thenThrow(new IllegalStateException("rate limited"));

        TranscriptEnrichment enrichment = new TranscriptEnricher(analysis, new ObjectMapper()).enrich(transcript, 7, "demo.mp4");

        assertThat(enrichment.enriched()).isFalse();
        assertThat(enrichment.error()).isEqualTo("rate limited");
        assertThat(enrichment.topics()).isEmpty();
    }

    @Test
    void unparseableResponseLeavesTranscriptUnenriched() throws Exception {
        when(analysis.analyze(any())).thenReturn("I think the topics are orders");

        TranscriptEnrichment enrichment = new TranscriptEnricher(analysis, new ObjectMapper()).enrich(transcript, 7, null);

        assertThat(enrichment.enriched()).isFalse();
        assertThat(enrichment.error()).startsWith("unparseable enrichment response");
    }

    @Test
    void emptyTranscriptIsNotSentToProvider() {
        TranscriptionEngine.Result empty = new TranscriptionEngine.Result("", List.of(), "auto", "none");

        TranscriptEnrichment enrichment = new TranscriptEnricher(analysis, new ObjectMapper()).enrich(empty, 7, null);

        assertThat(enrichment.enriched()).isFalse();
        assertThat(enrichment.error()).isNull();
        verifyNoInteractions(analysis);
    }
}
