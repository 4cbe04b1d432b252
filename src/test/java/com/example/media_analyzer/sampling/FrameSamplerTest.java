package com.example.media_analyzer.sampling;

import com.example.media_analyzer.exception.SourceUnreadableException;
import com.example.media_analyzer.util.ExtractionMethod;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FrameSamplerTest {

    private final FrameSampler sampler = new FrameSampler();

    @Test
    void staticVideoIsCoveredUniformlyWithinBounds() {
        // 65 s at 25 fps, nothing ever changes on screen
        SyntheticVideoSource video = new SyntheticVideoSource(25, 1625, n -> 90);

        List<CandidateFrame> frames = sampler.sample(video, SamplingParams.defaults());

        assertThat(frames).hasSizeBetween(10, 16);
        assertThat(frames).allMatch(f -> f.extractionMethod() == ExtractionMethod.UNIFORM);
        for (int i = 0; i < frames.size(); i++) {
            assertThat(frames.get(i).frameIndex()).isEqualTo(i);
            if (i > 0) {
                assertThat(frames.get(i).timestampSeconds()).isGreaterThan(frames.get(i - 1).timestampSeconds());
            }
        }
        assertThat(frames.get(frames.size() - 1).timestampSeconds()).isLessThan(65.0);
    }

    @Test
    void hardCutBetweenUniformSamplesIsAdded() {
        // cut at frame 575 (23.0 s); uniform samples land near 18.6 s and 27.8 s
        SyntheticVideoSource video = new SyntheticVideoSource(25, 1625, n -> n >= 575 ? 200 : 40);
        SamplingParams params = new SamplingParams(10.0, 3, 50, 20.0);

        List<CandidateFrame> frames = sampler.sample(video, params);

        List<CandidateFrame> scene = frames.stream()
                .filter(f -> f.extractionMethod() == ExtractionMethod.SCENE_CHANGE)
                .toList();
        assertThat(scene).hasSize(1);
        CandidateFrame cut = scene.get(0);
        assertThat(cut.timestampSeconds()).isEqualTo(23.04);
        assertThat(cut.frameNumber()).isEqualTo(576);
        assertThat(cut.sceneChangeScore()).isGreaterThan(20.0);
        assertThat(frames).hasSize(7);
        assertThat(frames.get(cut.frameIndex())).isSameAs(cut);
    }

    @Test
    void neverReturnsMoreThanMaxFrames() {
        // brightness flips every second, so every scan step looks like a cut
        SyntheticVideoSource video = new SyntheticVideoSource(25, 25 * 120, n -> (n / 25) % 2 == 0 ? 30 : 220);
        SamplingParams params = new SamplingParams(4.0, 10, 20, 20.0);

        List<CandidateFrame> frames = sampler.sample(video, params);

        assertThat(frames).hasSizeLessThanOrEqualTo(20);
        double previous = -1;
        for (CandidateFrame f : frames) {
            assertThat(f.timestampSeconds()).isGreaterThan(previous);
            previous = f.timestampSeconds();
        }
    }

    @Test
    void videoWithoutFramesIsUnreadable() {
        SyntheticVideoSource video = new SyntheticVideoSource(25, 0, n -> 0);

        assertThrows(SourceUnreadableException.class, () -> sampler.sample(video, SamplingParams.defaults()));
    }

    @Test
    void sparseResultOnLongVideoFallsBackToEvenSpacing() {
        // 20 s static video; one uniform target and no cuts leaves a single frame
        SyntheticVideoSource video = new SyntheticVideoSource(25, 500, n -> 120);
        SamplingParams params = new SamplingParams(100.0, 1, 5, 20.0);

        List<CandidateFrame> frames = sampler.sample(video, params);

        assertThat(frames).hasSize(5);
        assertThat(frames).extracting(CandidateFrame::frameNumber).containsExactly(83L, 166L, 249L, 332L, 415L);
        assertThat(frames).extracting(CandidateFrame::timestampSeconds).containsExactly(3.32, 6.64, 9.96, 13.28, 16.6);
        assertThat(frames).allMatch(f -> f.extractionMethod() == ExtractionMethod.UNIFORM);
        assertThat(frames).extracting(CandidateFrame::frameIndex).containsExactly(0, 1, 2, 3, 4);
        assertThat(video.grabbed().get(0).isReleased()).isTrue();
    }

    @Test
    void sparseResultOnShortVideoIsKept() {
        // 8 s is too short for the even-spacing fallback
        SyntheticVideoSource video = new SyntheticVideoSource(25, 200, n -> 120);

        List<CandidateFrame> frames = sampler.sample(video, new SamplingParams(100.0, 1, 5, 20.0));

        assertThat(frames).hasSize(1);
        assertThat(frames.get(0).timestampSeconds()).isEqualTo(4.0);
    }
}
