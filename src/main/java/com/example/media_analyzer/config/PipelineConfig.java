package com.example.media_analyzer.config;

import com.example.media_analyzer.dedup.FrameDeduplicator;
import com.example.media_analyzer.dedup.PerceptualHasher;
import com.example.media_analyzer.engine.Interfaces.VisionEngine;
import com.example.media_analyzer.sampling.FrameSampler;
import com.example.media_analyzer.vision.FallbackDescriptionFactory;
import com.example.media_analyzer.vision.FrameDescriber;
import com.example.media_analyzer.vision.FramePromptBuilder;
import com.example.media_analyzer.vision.KeywordRefusalDetector;
import com.example.media_analyzer.vision.RefusalDetector;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the frame algorithms. They are plain classes so tests build them without a context.
 */
@Configuration
@EnableConfigurationProperties(PipelineProperties.class)
public class PipelineConfig {

    @Bean
    public Clock systemClock() {
        return Clock.systemUTC();
    }

    @Bean
    public PerceptualHasher perceptualHasher(PipelineProperties props) {
        return new PerceptualHasher(props.getHashSize());
    }

    @Bean
    public FrameDeduplicator frameDeduplicator(PerceptualHasher hasher) {
        return new FrameDeduplicator(hasher);
    }

    @Bean
    public FrameSampler frameSampler() {
        return new FrameSampler();
    }

    @Bean
    public RefusalDetector refusalDetector() {
        return new KeywordRefusalDetector();
    }

    @Bean
    public FrameDescriber frameDescriber(VisionEngine visionEngine, RefusalDetector refusalDetector, ObjectMapper mapper) {
        return new FrameDescriber(visionEngine, refusalDetector, new FramePromptBuilder(mapper), new FallbackDescriptionFactory(mapper));
    }
}
