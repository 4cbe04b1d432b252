package com.example.media_analyzer.config;

import com.example.media_analyzer.engine.DummyTextAnalysisEngine;
import com.example.media_analyzer.engine.DummyTranscriptionEngine;
import com.example.media_analyzer.engine.DummyVisionEngine;
import com.example.media_analyzer.engine.Interfaces.TextAnalysisEngine;
import com.example.media_analyzer.engine.Interfaces.TranscriptionEngine;
import com.example.media_analyzer.engine.Interfaces.VisionEngine;
import com.example.media_analyzer.engine.OllamaTextAnalysisEngine;
import com.example.media_analyzer.engine.OllamaVisionEngine;
import com.example.media_analyzer.engine.OpenAITextAnalysisEngine;
import com.example.media_analyzer.engine.OpenAITranscriptionEngine;
import com.example.media_analyzer.engine.OpenAIVisionEngine;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Picks one engine per capability from {@code ai.*-provider}. The choice is fixed for the lifetime of the context.
 */
@Configuration
public class AiProviderConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(AiProviderConfig.class);

    @Bean
    TranscriptionEngine transcriptionEngine(AiProperties props,
                                            @Qualifier("openAiWebClient") WebClient openAi,
                                            ObjectMapper om) {
        AiProvider provider = props.getTranscriptionProvider();
        if (!provider.supportsTranscription()) {
            throw new IllegalStateException("ai.transcription-provider=" + provider.id() + " does not support transcription");
        }
        LOGGER.info("Transcription engine provider={}", provider.id());
        return switch (provider) {
            case OPENAI -> new OpenAITranscriptionEngine(openAi, props.getOpenai(), om);
            case DUMMY -> new DummyTranscriptionEngine();
            case OLLAMA -> throw new IllegalStateException("unreachable");
        };
    }

    @Bean
    VisionEngine visionEngine(AiProperties props,
                              @Qualifier("openAiWebClient") WebClient openAi,
                              @Qualifier("ollamaWebClient") WebClient ollama,
                              ObjectMapper om) {
        AiProvider provider = props.getVisionProvider();
        LOGGER.info("Vision engine provider={}", provider.id());
        return switch (provider) {
            case OPENAI -> new OpenAIVisionEngine(openAi, props.getOpenai(), om);
            case OLLAMA -> new OllamaVisionEngine(ollama, props.getOllama(), props.getOpenai().getVisionMaxTokens(), om);
            case DUMMY -> new DummyVisionEngine();
        };
    }

    @Bean
    TextAnalysisEngine textAnalysisEngine(AiProperties props,
                                          @Qualifier("openAiWebClient") WebClient openAi,
                                          @Qualifier("ollamaWebClient") WebClient ollama,
                                          ObjectMapper om) {
        AiProvider provider = props.getAnalysisProvider();
        LOGGER.info("Text analysis engine provider={}", provider.id());
        return switch (provider) {
            case OPENAI -> new OpenAITextAnalysisEngine(openAi, props.getOpenai(), om);
            case OLLAMA -> new OllamaTextAnalysisEngine(ollama, props.getOllama(), om);
            case DUMMY -> new DummyTextAnalysisEngine();
        };
    }
}
