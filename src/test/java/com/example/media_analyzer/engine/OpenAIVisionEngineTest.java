package com.example.media_analyzer.engine;

import com.example.media_analyzer.config.AiProperties;
import com.example.media_analyzer.engine.Interfaces.VisionEngine;
import com.example.media_analyzer.exception.TransportFailureException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.PrematureCloseException;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class OpenAIVisionEngineTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private OpenAIVisionEngine engine(ExchangeFunction exchange) {
        AiProperties.OpenAi props = new AiProperties.OpenAi();
        props.setVisionModel("gpt-4o");
        props.setVisionMaxTokens(1234);
        return new OpenAIVisionEngine(WebClient.builder().exchangeFunction(exchange).build(), props, mapper);
    }

    private static VisionEngine.Request request() {
        return new VisionEngine.Request(new byte[]{1, 2, 3}, "image/jpeg", "Describe this screen", Map.of("timestamp", 4.0));
    }

    @Test
    void sendsImageAsDataUrlAndReturnsMessageContent() throws Exception {
        AtomicReference<String> sent = new AtomicReference<>();
        ExchangeFunction exchange = req -> {
            sent.set(ExchangeStubs.writeBody(req));
            return Mono.just(ExchangeStubs.json(HttpStatus.OK,
                    "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"{\\\"summary\\\":\\\"Login\\\"}\"}}]}"));
        };

        String answer = engine(exchange).describe(request());

        assertThat(answer).isEqualTo("{\"summary\":\"Login\"}");
        JsonNode body = mapper.readTree(sent.get());
        assertThat(body.path("model").asText()).isEqualTo("gpt-4o");
        assertThat(body.path("max_completion_tokens").asInt()).isEqualTo(1234);
        JsonNode image = body.path("messages").get(1).path("content").get(1).path("image_url");
        assertThat(image.path("url").asText()).isEqualTo("data:image/jpeg;base64,AQID");
        assertThat(image.path("detail").asText()).isEqualTo("high");
    }

    @Test
    void refusalFieldIsReturnedWhenContentIsEmpty() throws Exception {
        ExchangeFunction exchange = req -> Mono.just(ExchangeStubs.json(HttpStatus.OK,
                "{\"choices\":[{\"message\":{\"content\":null,\"refusal\":\"I'm sorry, I can't help with that.\"}}]}"));

        assertThat(engine(exchange).describe(request())).isEqualTo("I'm sorry, I can't help with that.");
    }

    @Test
    void transportFailureIsNotRetried() {
        AtomicInteger attempts = new AtomicInteger();
        ExchangeFunction exchange = req -> {
            attempts.incrementAndGet();
            return Mono.error(PrematureCloseException.TEST_EXCEPTION);
        };

        assertThrows(TransportFailureException.class, () -> engine(exchange).describe(request()));
        assertThat(attempts.get()).isEqualTo(1);
    }

    @Test
    void serverErrorBecomesTransportFailure() {
        ExchangeFunction exchange = req -> Mono.just(ExchangeStubs.json(HttpStatus.SERVICE_UNAVAILABLE, "{\"error\":\"overloaded\"}"));

        TransportFailureException ex = assertThrows(TransportFailureException.class, () -> engine(exchange).describe(request()));
        assertThat(ex.getMessage()).contains("503").contains("overloaded");
    }
}
