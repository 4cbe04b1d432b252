package com.example.media_analyzer.vision;

import com.example.media_analyzer.sampling.CandidateFrame;
import com.example.media_analyzer.sampling.InMemoryFrameImage;
import com.example.media_analyzer.sampling.TestImages;
import com.example.media_analyzer.util.ExtractionMethod;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FramePromptBuilderTest {

    private final FramePromptBuilder builder = new FramePromptBuilder(new ObjectMapper());

    private static SampledFrame frame(String hint) {
        CandidateFrame candidate = new CandidateFrame(1, 65.0, 1625,
                new InMemoryFrameImage(TestImages.solid(4, 4, 0)), ExtractionMethod.SCENE_CHANGE, 42.0);
        return new SampledFrame(candidate, "we open the cart", List.of("Checkout"), hint);
    }

    @Test
    void previousJsonDescriptionContributesSummaryAndModule() {
        String prompt = builder.contextual(
                frame("{\"summary\":\"Product list\",\"module_name\":\"Catalog\"}"),
                new FrameContext("Web shop", List.of("cart", "checkout")));

        assertThat(prompt)
                .contains("Application: Web shop")
                .contains("Timestamp: 1:05 (65.0s)")
                .contains("we open the cart")
                .contains("Topics being discussed: Checkout")
                .contains("Keywords: cart, checkout")
                .contains("Previous frame summary: Product list")
                .contains("Previous frame module: Catalog");
    }

    @Test
    void previousProseDescriptionIsQuotedRaw() {
        assertThat(builder.continuityLines("A login form with two fields"))
                .containsExactly("Previous frame: A login form with two fields");
    }

    @Test
    void firstFrameHasNoContinuityLines() {
        assertThat(builder.continuityLines(null)).isEmpty();
        assertThat(builder.contextual(frame(null), FrameContext.empty())).doesNotContain("Previous frame");
    }
}
