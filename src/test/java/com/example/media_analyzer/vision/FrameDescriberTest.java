package com.example.media_analyzer.vision;

import com.example.media_analyzer.engine.Interfaces.VisionEngine;
import com.example.media_analyzer.sampling.CandidateFrame;
import com.example.media_analyzer.sampling.InMemoryFrameImage;
import com.example.media_analyzer.sampling.TestImages;
import com.example.media_analyzer.util.ExtractionMethod;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FrameDescriberTest {

    @Mock
    private VisionEngine vision;

    private final ObjectMapper mapper = new ObjectMapper();
    private FrameDescriber describer;

    @BeforeEach
    void setUp() {
        describer = new FrameDescriber(vision, new KeywordRefusalDetector(),
                new FramePromptBuilder(mapper), new FallbackDescriptionFactory(mapper));
    }

    private static SampledFrame frame(double ts, String window) {
        CandidateFrame candidate = new CandidateFrame(0, ts, (long) (ts * 25),
                new InMemoryFrameImage(TestImages.solid(32, 18, 120)), ExtractionMethod.UNIFORM, 0);
        return new SampledFrame(candidate, window, List.of("Login"), null);
    }

    @Test
    void acceptedPrimaryAnswerUsesOneCall() throws Exception {
        when(vision.describe(any())).thenReturn("{\"summary\":\"Login screen\"}");

        FrameDescription result = describer.describe(frame(12.0, "now we log in"), new FrameContext("Shop admin", List.of()));

        assertThat(result.fallback()).isFalse();
        assertThat(result.externalCalls()).isEqualTo(1);
        assertThat(result.text()).contains("Login screen");

        ArgumentCaptor<VisionEngine.Request> captor = ArgumentCaptor.forClass(VisionEngine.Request.class);
        verify(vision).describe(captor.capture());
        VisionEngine.Request request = captor.getValue();
        assertThat(request.mediaType()).isEqualTo("image/jpeg");
        assertThat(request.image()).isNotEmpty();
        assertThat(request.prompt()).contains("Shop admin").contains("now we log in");
        assertThat(request.context()).containsEntry("timestamp", 12.0);
    }

    @Test
    void persistentRefusalFallsBackAfterTwoCalls() throws Exception {
        when(vision.describe(any())).thenReturn("I'm sorry, I can't assist with that.");

        FrameDescription result = describer.describe(frame(75.0, "the order list"), new FrameContext("order management", List.of()));

        assertThat(result.fallback()).isTrue();
        assertThat(result.externalCalls()).isEqualTo(2);
        verify(vision, times(2)).describe(any());

        JsonNode doc = mapper.readTree(result.text());
        assertThat(doc.path("fallback").asBoolean()).isTrue();
        assertThat(doc.path("confidence").asText()).isEqualTo("low");
        assertThat(doc.path("screen_type").asText()).isEqualTo("order_management");
        assertThat(doc.path("summary").asText()).contains("1:15");
    }

    @Test
    void failedPrimaryIsRetriedWithSimplifiedPrompt() throws Exception {
        when(vision.describe(any()))
                .thenThrow(new IllegalStateException("timeout"))
                .thenReturn("{\"summary\":\"Settings page\"}");

        FrameDescription result = describer.describe(frame(3.0, ""), FrameContext.empty());

        assertThat(result.fallback()).isFalse();
        assertThat(result.externalCalls()).isEqualTo(2);

        ArgumentCaptor<VisionEngine.Request> captor = ArgumentCaptor.forClass(VisionEngine.Request.class);
        verify(vision, times(2)).describe(captor.capture());
        assertThat(captor.getAllValues().get(1).prompt()).isEqualTo(new FramePromptBuilder(mapper).simplified());
    }

    @Test
    void undecodableFrameGetsFallbackWithoutCalls() {
        SampledFrame frame = frame(5.0, "hello");
        frame.frame().image().release();

        FrameDescription result = describer.describe(frame, FrameContext.empty());

        assertThat(result.fallback()).isTrue();
        assertThat(result.externalCalls()).isZero();
        verifyNoInteractions(vision);
    }
}
