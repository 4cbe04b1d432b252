package com.example.media_analyzer.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import io.netty.resolver.DefaultAddressResolverGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.HttpProtocol;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * HTTP clients for the AI providers. Socket timeouts are sized for the slowest call of each provider;
 * the per-call bound is applied by the engines when they block.
 */
@Configuration
@EnableConfigurationProperties(AiProperties.class)
public class AiClientConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(AiClientConfig.class);
    private static final int CONNECT_TIMEOUT_MILLIS = 10_000;
    private static final int MAX_CONNECTIONS = 10;
    private static final Duration PENDING_ACQUIRE_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration MAX_IDLE_TIME = Duration.ofSeconds(20);
    private static final Duration MAX_LIFE_TIME = Duration.ofMinutes(5);
    private static final int MAX_IN_MEMORY_BYTES = 32 * 1024 * 1024;

    @Bean("openAiWebClient")
    WebClient openAiWebClient(AiProperties props) {
        AiProperties.OpenAi openai = props.getOpenai();
        Duration socketTimeout = Duration.ofSeconds(Math.max(openai.getTimeoutSeconds(), openai.getTranscriptionTimeoutSeconds()));
        WebClient.Builder builder = WebClient.builder()
                .baseUrl(openai.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient("openai-http", socketTimeout)))
                .defaultHeader("Accept", "application/json")
                .codecs(c -> c.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES));
        String key = openai.getApiKey() == null ? "" : openai.getApiKey().trim();
        if (!key.isEmpty()) {
            builder.defaultHeader("Authorization", "Bearer " + key);
        }
        return builder.build();
    }

    @Bean("ollamaWebClient")
    WebClient ollamaWebClient(AiProperties props) {
        AiProperties.Ollama ollama = props.getOllama();
        return WebClient.builder()
                .baseUrl(ollama.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient("ollama-http", Duration.ofSeconds(ollama.getTimeoutSeconds()))))
                .defaultHeader("Accept", "application/json")
                .codecs(c -> c.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES))
                .build();
    }

    private static HttpClient httpClient(String name, Duration socketTimeout) {
        ConnectionProvider provider = ConnectionProvider.builder(name)
                .maxConnections(MAX_CONNECTIONS)
                .pendingAcquireTimeout(PENDING_ACQUIRE_TIMEOUT)
                .maxIdleTime(MAX_IDLE_TIME)
                .maxLifeTime(MAX_LIFE_TIME)
                .build();
        LOGGER.info("Configuring {} client connect={}ms response={}s maxConn={}",
                name, CONNECT_TIMEOUT_MILLIS, socketTimeout.toSeconds(), MAX_CONNECTIONS);
        return HttpClient.create(provider)
                .protocol(HttpProtocol.HTTP11)
                .compress(false)
                .responseTimeout(socketTimeout)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS)
                .resolver(DefaultAddressResolverGroup.INSTANCE)
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(socketTimeout.toSeconds(), TimeUnit.SECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(socketTimeout.toSeconds(), TimeUnit.SECONDS)));
    }
}
