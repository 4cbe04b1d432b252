package com.example.media_analyzer.service;

import com.example.media_analyzer.dto.media.TopicSpan;
import com.example.media_analyzer.engine.Interfaces.TranscriptionEngine;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TranscriptContextTest {

    private final List<TranscriptionEngine.Segment> segments = List.of(
            new TranscriptionEngine.Segment(0.0, 4.0, "Welcome to the demo."),
            new TranscriptionEngine.Segment(4.0, 9.0, " Here is the order list. "),
            new TranscriptionEngine.Segment(9.0, 15.0, "Now we open settings."),
            new TranscriptionEngine.Segment(30.0, 35.0, "Goodbye."));

    @Test
    void windowJoinsOverlappingSegmentsInOrder() {
        assertThat(TranscriptContext.window(segments, 8.0, 5.0))
                .isEqualTo("Welcome to the demo. Here is the order list. Now we open settings.");
    }

    @Test
    void windowWithoutOverlapIsEmpty() {
        assertThat(TranscriptContext.window(segments, 22.0, 5.0)).isEmpty();
        assertThat(TranscriptContext.window(List.of(), 1.0, 5.0)).isEmpty();
    }

    @Test
    void topicsAtReturnsEveryCoveringTopic() {
        List<TopicSpan> topics = List.of(
                new TopicSpan("Intro", 0, 10, ""),
                new TopicSpan("Orders", 5, 20, ""),
                new TopicSpan("Outro", 28, Double.MAX_VALUE, ""));

        assertThat(TranscriptContext.topicsAt(topics, 7)).containsExactly("Intro", "Orders");
        assertThat(TranscriptContext.topicsAt(topics, 100)).containsExactly("Outro");
        assertThat(TranscriptContext.topicsAt(topics, 25)).isEmpty();
    }
}
