package com.example.media_analyzer.engine;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.example.media_analyzer.config.AiProperties;
import com.example.media_analyzer.engine.Interfaces.TranscriptionEngine;
import com.example.media_analyzer.exception.TransportFailureException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.PrematureCloseException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class OpenAITranscriptionEngineTest {

    @TempDir
    Path tempDir;

    private Path audio;

    @BeforeEach
    void setup() throws Exception {
        audio = tempDir.resolve("audio.mp3");
        Files.writeString(audio, "data");
    }

    private static OpenAITranscriptionEngine engine(ExchangeFunction exchange) {
        return new OpenAITranscriptionEngine(WebClient.builder().exchangeFunction(exchange).build(),
                new AiProperties.OpenAi(), new ObjectMapper());
    }

    @Test
    void retriesOnPrematureCloseException() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        AtomicReference<String> sent = new AtomicReference<>();

        ExchangeFunction exchange = request -> {
            if (attempts.incrementAndGet() < 3) {
                return Mono.error(PrematureCloseException.TEST_EXCEPTION);
            }
            sent.set(ExchangeStubs.writeBody(request));
            return Mono.just(ExchangeStubs.json(HttpStatus.OK,
                    "{\"text\":\"ok\",\"language\":\"English\",\"segments\":[{\"start\":0.0,\"end\":1.5,\"text\":\" ok \"}]}"));
        };

        TranscriptionEngine.Result result = engine(exchange).transcribe(new TranscriptionEngine.Request(audio, "IT"));

        assertThat(attempts.get()).isEqualTo(3);
        assertThat(result.text()).isEqualTo("ok");
        assertThat(result.lang()).isEqualTo("english");
        assertThat(result.provider()).isEqualTo("openai");
        assertThat(result.segments()).hasSize(1);
        assertThat(result.segments().get(0).text()).isEqualTo("ok");
        assertThat(sent.get())
                .contains("name=\"response_format\"").contains("verbose_json")
                .contains("name=\"timestamp_granularities[]\"")
                .contains("name=\"language\"");
    }

    @Test
    void logsEachTransientRetryAsWarning() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        ExchangeFunction exchange = request -> {
            if (attempts.incrementAndGet() < 3) {
                return Mono.error(PrematureCloseException.TEST_EXCEPTION);
            }
            return Mono.just(ExchangeStubs.json(HttpStatus.OK, "{\"text\":\"ok\"}"));
        };

        Logger logger = (Logger) org.slf4j.LoggerFactory.getLogger(OpenAITranscriptionEngine.class);
        ListAppender<ILoggingEvent> listAppender = new ListAppender<>();
        listAppender.start();
        logger.addAppender(listAppender);
        try {
            engine(exchange).transcribe(new TranscriptionEngine.Request(audio, null));

            List<String> warnMessages = listAppender.list.stream()
                    .filter(event -> event.getLevel() == Level.WARN)
                    .map(ILoggingEvent::getFormattedMessage)
                    .toList();
            assertThat(warnMessages).hasSize(2);
            assertThat(warnMessages.get(0)).contains("attempt=1").contains("file=audio.mp3");
            assertThat(warnMessages.get(1)).contains("attempt=2");
        } finally {
            logger.detachAppender(listAppender);
        }
    }

    @Test
    void doesNotRetryOn4xxErrors() {
        AtomicInteger attempts = new AtomicInteger();
        ExchangeFunction exchange = request -> {
            attempts.incrementAndGet();
            return Mono.just(ExchangeStubs.json(HttpStatus.BAD_REQUEST, "{\"error\":\"bad\"}"));
        };

        TransportFailureException ex = assertThrows(TransportFailureException.class,
                () -> engine(exchange).transcribe(new TranscriptionEngine.Request(audio, null)));

        assertThat(attempts.get()).isEqualTo(1);
        assertThat(ex.getMessage()).contains("400");
    }

    @Test
    void missingLanguageAndTextFallBackToSegments() {
        OpenAITranscriptionEngine engine = engine(request -> Mono.error(new IllegalStateException("unused")));

        TranscriptionEngine.Result result = engine.parse(
                "{\"segments\":[{\"start\":0,\"end\":2,\"text\":\"first\"},{\"start\":2,\"end\":1,\"text\":\"second\"}]}");

        assertThat(result.text()).isEqualTo("first second");
        assertThat(result.lang()).isEqualTo("auto");
        assertThat(result.segments().get(1).end()).isEqualTo(2.0);
    }

    @Test
    void missingAudioFileIsRejectedBeforeAnyCall() {
        AtomicInteger attempts = new AtomicInteger();
        OpenAITranscriptionEngine engine = engine(request -> {
            attempts.incrementAndGet();
            return Mono.empty();
        });

        assertThrows(IllegalArgumentException.class,
                () -> engine.transcribe(new TranscriptionEngine.Request(tempDir.resolve("missing.mp3"), null)));
        assertThat(attempts.get()).isZero();
    }
}
