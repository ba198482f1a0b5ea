package com.relayline.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * WebClient configuration for HTTP requests to providers and the app-data service.
 */
@Configuration
public class WebClientConfiguration {

    private static final int MAX_RESPONSE_BYTES = 4 * 1024 * 1024;

    private final RelaylineProperties properties;

    public WebClientConfiguration(RelaylineProperties properties) {
        this.properties = properties;
    }

    @Bean
    public WebClient webClient() {
        // Network-level ceiling; adapters apply their own shorter per-call timeouts
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(longestProviderTimeout());

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_RESPONSE_BYTES))
                .build();
    }

    private Duration longestProviderTimeout() {
        Duration longest = new RelaylineProperties.ProviderConfig().getTimeout();
        for (RelaylineProperties.ProviderConfig config : properties.getProviders().values()) {
            if (config.getTimeout() != null && config.getTimeout().compareTo(longest) > 0) {
                longest = config.getTimeout();
            }
        }
        return longest.plusSeconds(5);
    }
}
