package com.example.media_analyzer.engine;

import com.example.media_analyzer.config.AiProperties;
import com.example.media_analyzer.engine.Interfaces.TranscriptionEngine;
import com.example.media_analyzer.exception.TransportFailureException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.HttpStatusCode;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.util.retry.Retry;

import java.nio.file.Files;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Whisper style transcription through {@code /v1/audio/transcriptions} with segment timestamps.
 */
public class OpenAITranscriptionEngine implements TranscriptionEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAITranscriptionEngine.class);
    private static final Duration RETRY_BACKOFF = Duration.ofMillis(200);
    private static final int RETRY_MAX_ATTEMPTS = 2;

    private final WebClient client;
    private final AiProperties.OpenAi props;
    private final ObjectMapper om;

    public OpenAITranscriptionEngine(WebClient client, AiProperties.OpenAi props, ObjectMapper om) {
        this.client = client;
        this.props = props;
        this.om = om;
    }

    @Override
    public Result transcribe(Request request) throws Exception {
        if (!Files.isRegularFile(request.audioFile())) {
            throw new IllegalArgumentException("audio not found: " + request.audioFile());
        }
        var form = new LinkedMultiValueMap<String, Object>();
        form.add("file", new FileSystemResource(request.audioFile()));
        form.add("model", props.getTranscriptionModel());
        form.add("response_format", "verbose_json");
        form.add("timestamp_granularities[]", "segment");
        if (request.langHint() != null && !request.langHint().isBlank()) {
            form.add("language", request.langHint().toLowerCase(Locale.ROOT));
        }

        long t0 = System.nanoTime();
        String body;
        try {
            body = client.post()
                    .uri("/v1/audio/transcriptions")
                    .body(BodyInserters.fromMultipartData(form))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, resp -> resp.bodyToMono(String.class).defaultIfEmpty("")
                            .map(err -> new TransportFailureException("OpenAI ASR error %s: %s".formatted(resp.statusCode(), EngineFailures.truncate(err, 500)))))
                    .bodyToMono(String.class)
                    .retryWhen(Retry.backoff(RETRY_MAX_ATTEMPTS, RETRY_BACKOFF)
                            .filter(EngineFailures::isTransient)
                            .doBeforeRetry(signal -> LOGGER.warn("OpenAI ASR retry attempt={} file={} err={}",
                                    signal.totalRetriesInARow() + 1, request.audioFile().getFileName(), String.valueOf(signal.failure()))))
                    .block(Duration.ofSeconds(props.getTranscriptionTimeoutSeconds()));
        } catch (RuntimeException e) {
            throw EngineFailures.transport("OpenAI transcription", e);
        }
        if (body == null || body.isBlank()) {
            throw new TransportFailureException("Empty response from OpenAI ASR");
        }
        Result result = parse(body);
        LOGGER.info("OpenAI ASR done file={} segments={} chars={} lang={} durMs={}", request.audioFile().getFileName(),
                result.segments().size(), result.text().length(), result.lang(), (System.nanoTime() - t0) / 1_000_000);
        return result;
    }

    Result parse(String body) {
        JsonNode root;
        try {
            root = om.readTree(body);
        } catch (JsonProcessingException e) {
            throw new TransportFailureException("OpenAI ASR returned invalid JSON: " + EngineFailures.truncate(body, 200), e);
        }
        List<Segment> segments = new ArrayList<>();
        for (JsonNode seg : root.path("segments")) {
            String text = seg.path("text").asText("").trim();
            double start = seg.path("start").asDouble(0);
            double end = Math.max(start, seg.path("end").asDouble(start));
            segments.add(new Segment(start, end, text));
        }
        String text = root.path("text").asText("").trim();
        if (text.isEmpty() && !segments.isEmpty()) {
            text = String.join(" ", segments.stream().map(Segment::text).filter(s -> !s.isBlank()).toList());
        }
        String lang = root.path("language").asText("");
        return new Result(text, segments, lang.isBlank() ? "auto" : lang.toLowerCase(Locale.ROOT), "openai");
    }
}
