package com.gateprep.llm.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * WebClient setup shared by every provider client.
 *
 * The per-attempt deadline is enforced by each client with {@code Mono.timeout};
 * the connect timeout here only bounds socket establishment.
 */
@Configuration
public class WebClientConfig {

    // Generated content is small; 2MB leaves room for verbose error envelopes.
    private static final int MAX_IN_MEMORY_SIZE = 2 * 1024 * 1024;

    private static final int CONNECT_TIMEOUT_MILLIS = 10_000;

    @Bean
    public WebClient.Builder webClientBuilder() {
        return createBuilder();
    }

    public static WebClient.Builder createBuilder() {
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(configurer -> configurer
                        .defaultCodecs()
                        .maxInMemorySize(MAX_IN_MEMORY_SIZE))
                .build();

        HttpClient httpClient = HttpClient.create()
                .option(io.netty.channel.ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS);

        return WebClient.builder()
                .exchangeStrategies(strategies)
                .clientConnector(new ReactorClientHttpConnector(httpClient));
    }
}
