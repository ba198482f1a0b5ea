package com.relayline.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.relayline.config.RelaylineProperties;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * OpenRouter aggregator provider.
 * Defaults to a free-tier model; OpenRouter asks callers to identify themselves via
 * {@code HTTP-Referer} and {@code X-Title}.
 */
@Component
public class OpenRouterProvider extends OpenAiCompatibleProvider {

    private static final String REFERER = "https://blockwise.app";
    private static final String TITLE = "BlockWise AI Assistant";

    public OpenRouterProvider(WebClient webClient, ObjectMapper objectMapper, RelaylineProperties properties) {
        super(ProviderId.OPENROUTER, webClient, objectMapper, properties);
    }

    @Override
    protected String defaultBaseUrl() {
        return "https://openrouter.ai/api/v1";
    }

    @Override
    protected String defaultModel() {
        return "meta-llama/llama-3.1-8b-instruct:free";
    }

    @Override
    protected void addHeaders(HttpHeaders headers) {
        headers.add("HTTP-Referer", REFERER);
        headers.add("X-Title", TITLE);
    }
}
